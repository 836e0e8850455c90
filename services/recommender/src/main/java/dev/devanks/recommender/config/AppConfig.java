// services/recommender/src/main/java/dev/devanks/recommender/config/AppConfig.java
package dev.devanks.recommender.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

@Configuration
@Slf4j
public class AppConfig {

    public static final String PROVIDER_EXECUTOR = "providerExecutor";
    public static final String POINT_EXECUTOR = "pointExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Runs individual provider calls. Unbounded: callers bound the fan-out themselves.
     */
    @Bean(name = PROVIDER_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor() {
        log.info("Initializing provider call executor.");
        return Executors.newCachedThreadPool(daemonThreads("provider-call-%d"));
    }

    /**
     * Runs per-district aggregations; admission is gated by the fleet aggregator.
     */
    @Bean(name = POINT_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService pointExecutor() {
        log.info("Initializing district aggregation executor.");
        return Executors.newCachedThreadPool(daemonThreads("district-aggregate-%d"));
    }

    private static ThreadFactory daemonThreads(String nameFormat) {
        return new ThreadFactoryBuilder()
                .setNameFormat(nameFormat)
                .setDaemon(true)
                .build();
    }
}
