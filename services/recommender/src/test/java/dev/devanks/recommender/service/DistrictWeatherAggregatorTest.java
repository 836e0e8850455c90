// services/recommender/src/test/java/dev/devanks/recommender/service/DistrictWeatherAggregatorTest.java
package dev.devanks.recommender.service;

import dev.devanks.recommender.client.OpenMeteoProviderClient;
import dev.devanks.recommender.exception.ProviderDataException;
import dev.devanks.recommender.exception.ProviderTransportException;
import dev.devanks.recommender.model.DailyReading;
import dev.devanks.recommender.model.DestinationWeather;
import dev.devanks.recommender.model.District;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static dev.devanks.recommender.model.ProviderKind.AIR_QUALITY;
import static dev.devanks.recommender.model.ProviderKind.TEMPERATURE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DistrictWeatherAggregatorTest {

    private static final District SYLHET = District.builder()
            .id("36").divisionId("5").name("Sylhet").bnName("সিলেট").lat(24.8897956).lon(91.8697894).build();

    @Mock
    private OpenMeteoProviderClient mockProviderClient;

    private ExecutorService executor;
    private DistrictWeatherAggregator aggregator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        aggregator = new DistrictWeatherAggregator(mockProviderClient, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("aggregate - merges temperature and PM2.5 into an unranked record")
    void aggregate_Success() {
        when(mockProviderClient.fetchDaily(TEMPERATURE, SYLHET.getLat(), SYLHET.getLon())).thenReturn(24.13);
        when(mockProviderClient.fetchDaily(AIR_QUALITY, SYLHET.getLat(), SYLHET.getLon())).thenReturn(31.5);

        DestinationWeather weather = aggregator.aggregate(SYLHET);

        assertThat(weather.getId()).isEqualTo("36");
        assertThat(weather.getName()).isEqualTo("Sylhet");
        assertThat(weather.getBnName()).isEqualTo("সিলেট");
        assertThat(weather.getAvgTemp2pmCelsius()).isEqualTo(24.13);
        assertThat(weather.getAvgPm25()).isEqualTo(31.5);
        assertThat(weather.getRank()).isZero();
    }

    @Test
    @DisplayName("aggregate - PM2.5 failure fails the district")
    void aggregate_AirQualityFails() {
        when(mockProviderClient.fetchDaily(TEMPERATURE, SYLHET.getLat(), SYLHET.getLon())).thenReturn(24.13);
        when(mockProviderClient.fetchDaily(AIR_QUALITY, SYLHET.getLat(), SYLHET.getLon()))
                .thenThrow(new ProviderTransportException(AIR_QUALITY, 500, "air quality API returned status 500", null));

        assertThatThrownBy(() -> aggregator.aggregate(SYLHET))
                .isInstanceOf(ProviderTransportException.class)
                .hasMessage("air quality API returned status 500");
    }

    @Test
    @DisplayName("aggregate - when both fail the temperature error is reported")
    void aggregate_BothFail_TemperatureWins() {
        when(mockProviderClient.fetchDaily(TEMPERATURE, SYLHET.getLat(), SYLHET.getLon()))
                .thenThrow(new ProviderDataException(TEMPERATURE, ProviderDataException.Kind.NO_DATA,
                        "no 2PM temperature data found"));
        when(mockProviderClient.fetchDaily(AIR_QUALITY, SYLHET.getLat(), SYLHET.getLon()))
                .thenThrow(new ProviderTransportException(AIR_QUALITY, 500, "air quality API returned status 500", null));

        assertThatThrownBy(() -> aggregator.aggregate(SYLHET))
                .isInstanceOf(ProviderDataException.class)
                .hasMessage("no 2PM temperature data found");
    }

    @Test
    @DisplayName("readingForDateAsync - fetches both values for the given day")
    void readingForDateAsync_Success() {
        LocalDate day = LocalDate.of(2025, 6, 1);
        when(mockProviderClient.fetchDaily(TEMPERATURE, 23.81, 90.41, day)).thenReturn(35.5);
        when(mockProviderClient.fetchDaily(AIR_QUALITY, 23.81, 90.41, day)).thenReturn(75.0);

        CompletableFuture<DailyReading> reading = aggregator.readingForDateAsync(23.81, 90.41, day);

        assertThat(reading.join()).isEqualTo(new DailyReading(35.5, 75.0));
        verify(mockProviderClient).fetchDaily(TEMPERATURE, 23.81, 90.41, day);
    }

    @Test
    @DisplayName("readingForDateAsync - failure surfaces as a CompletionException around the provider error")
    void readingForDateAsync_Failure() {
        LocalDate day = LocalDate.of(2025, 6, 1);
        when(mockProviderClient.fetchDaily(TEMPERATURE, 23.81, 90.41, day))
                .thenThrow(new ProviderTransportException(TEMPERATURE, 502, "weather API returned status 502", null));
        when(mockProviderClient.fetchDaily(AIR_QUALITY, 23.81, 90.41, day)).thenReturn(75.0);

        CompletableFuture<DailyReading> reading = aggregator.readingForDateAsync(23.81, 90.41, day);

        assertThatThrownBy(reading::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ProviderTransportException.class);
    }
}
