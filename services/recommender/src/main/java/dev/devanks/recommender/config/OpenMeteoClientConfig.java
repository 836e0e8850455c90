// services/recommender/src/main/java/dev/devanks/recommender/config/OpenMeteoClientConfig.java
package dev.devanks.recommender.config;

import feign.Logger.Level;
import feign.Request;
import feign.RequestInterceptor;
import feign.Retryer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

import static feign.Logger.Level.BASIC;
import static org.springframework.http.HttpHeaders.ACCEPT;
import static org.springframework.http.HttpHeaders.USER_AGENT;
import static org.springframework.http.MediaType.APPLICATION_JSON_VALUE;

/**
 * Shared Feign setup for both Open-Meteo clients: one attempt per call, bounded by the provider timeout.
 */
@RequiredArgsConstructor
@Slf4j
public class OpenMeteoClientConfig {

    private final RecommenderProperties properties;

    @Bean
    public RequestInterceptor openMeteoHeadersInterceptor() {
        return template -> {
            template.header(USER_AGENT, "Cool-Destinations-Recommender-Feign/1.0");
            template.header(ACCEPT, APPLICATION_JSON_VALUE);
        };
    }

    @Bean
    public Request.Options openMeteoRequestOptions() {
        long timeoutMillis = properties.getProvider().getTimeout().toMillis();
        log.info("Open-Meteo clients use a {} ms connect/read timeout.", timeoutMillis);
        return new Request.Options(timeoutMillis, TimeUnit.MILLISECONDS, timeoutMillis, TimeUnit.MILLISECONDS, true);
    }

    @Bean
    public Retryer openMeteoRetryer() {
        return Retryer.NEVER_RETRY;
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }
}
