// services/recommender/src/main/java/dev/devanks/recommender/service/CacheWarmupRunner.java
package dev.devanks.recommender.service;

import dev.devanks.recommender.config.RecommenderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Fills the destination cache once the application is up, then keeps it fresh in the background.
 * A failed warm-up is logged and the first request retries the refresh.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheWarmupRunner implements ApplicationRunner {

    private final CachedDestinationService cachedDestinationService;
    private final RecommenderProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        RecommenderProperties.CacheProperties cache = properties.getCache();
        log.info("Warming destination cache (timeout {} s)...", cache.getWarmupTimeout().toSeconds());
        try {
            cachedDestinationService.warm(cache.getWarmupTimeout());
        } catch (RuntimeException e) {
            log.error("Destination cache warm-up failed: {}", e.getMessage(), e);
        }

        if (cache.isBackgroundRefreshEnabled()) {
            cachedDestinationService.startBackgroundRefresh();
        } else {
            log.info("Background destination refresh disabled.");
        }
    }
}
