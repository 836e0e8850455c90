// services/recommender/src/test/java/dev/devanks/recommender/service/CacheWarmupRunnerTest.java
package dev.devanks.recommender.service;

import dev.devanks.recommender.config.RecommenderProperties;
import dev.devanks.recommender.exception.DeadlineExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CacheWarmupRunnerTest {

    @Mock
    private CachedDestinationService mockCachedDestinationService;

    private RecommenderProperties properties;
    private CacheWarmupRunner runner;

    @BeforeEach
    void setUp() {
        properties = new RecommenderProperties();
        runner = new CacheWarmupRunner(mockCachedDestinationService, properties);
    }

    @Test
    @DisplayName("run - warms the cache and starts the background refresh")
    void run_WarmsAndStartsRefresh() {
        runner.run(new DefaultApplicationArguments());

        verify(mockCachedDestinationService).warm(Duration.ofSeconds(60));
        verify(mockCachedDestinationService).startBackgroundRefresh();
    }

    @Test
    @DisplayName("run - a failed warm-up is not fatal")
    void run_WarmupFailureIsLogged() {
        doThrow(new DeadlineExceededException("Top destinations refresh", Duration.ofSeconds(60)))
                .when(mockCachedDestinationService).warm(Duration.ofSeconds(60));

        assertThatCode(() -> runner.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
        verify(mockCachedDestinationService).startBackgroundRefresh();
    }

    @Test
    @DisplayName("run - background refresh can be switched off")
    void run_BackgroundRefreshDisabled() {
        properties.getCache().setBackgroundRefreshEnabled(false);

        runner.run(new DefaultApplicationArguments());

        verify(mockCachedDestinationService).warm(Duration.ofSeconds(60));
        verify(mockCachedDestinationService, never()).startBackgroundRefresh();
    }
}
