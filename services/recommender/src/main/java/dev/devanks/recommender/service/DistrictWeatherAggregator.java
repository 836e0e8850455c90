// services/recommender/src/main/java/dev/devanks/recommender/service/DistrictWeatherAggregator.java
package dev.devanks.recommender.service;

import dev.devanks.recommender.client.OpenMeteoProviderClient;
import dev.devanks.recommender.model.DailyReading;
import dev.devanks.recommender.model.DestinationWeather;
import dev.devanks.recommender.model.District;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

import static dev.devanks.recommender.config.AppConfig.PROVIDER_EXECUTOR;
import static dev.devanks.recommender.model.ProviderKind.AIR_QUALITY;
import static dev.devanks.recommender.model.ProviderKind.TEMPERATURE;

/**
 * Fetches temperature and PM2.5 for one location concurrently and merges them. Either failure fails the
 * whole location; when both fail the temperature error is the one reported.
 */
@Service
@Slf4j
public class DistrictWeatherAggregator {

    private final OpenMeteoProviderClient providerClient;
    private final ExecutorService providerExecutor;

    public DistrictWeatherAggregator(OpenMeteoProviderClient providerClient,
                                     @Qualifier(PROVIDER_EXECUTOR) ExecutorService providerExecutor) {
        this.providerClient = providerClient;
        this.providerExecutor = providerExecutor;
    }

    /**
     * 7-day 2PM averages for a tracked district, unranked.
     */
    public DestinationWeather aggregate(District district) {
        DailyReading reading = FutureResults.await(readingAsync(
                () -> providerClient.fetchDaily(TEMPERATURE, district.getLat(), district.getLon()),
                () -> providerClient.fetchDaily(AIR_QUALITY, district.getLat(), district.getLon())));

        log.debug("District {} ({}): temp={}, pm25={}", district.getId(), district.getName(),
                reading.getTemperatureCelsius(), reading.getPm25());
        return DestinationWeather.builder()
                .id(district.getId())
                .name(district.getName())
                .bnName(district.getBnName())
                .avgTemp2pmCelsius(reading.getTemperatureCelsius())
                .avgPm25(reading.getPm25())
                .build();
    }

    /**
     * 2PM readings for a single day at arbitrary coordinates. The returned future fails with the provider's
     * own exception (wrapped in a {@link java.util.concurrent.CompletionException}).
     */
    public CompletableFuture<DailyReading> readingForDateAsync(double lat, double lon, LocalDate date) {
        return readingAsync(
                () -> providerClient.fetchDaily(TEMPERATURE, lat, lon, date),
                () -> providerClient.fetchDaily(AIR_QUALITY, lat, lon, date));
    }

    private CompletableFuture<DailyReading> readingAsync(Supplier<Double> temperature, Supplier<Double> pm25) {
        CompletableFuture<Double> temperatureCall = CompletableFuture.supplyAsync(temperature, providerExecutor);
        CompletableFuture<Double> pm25Call = CompletableFuture.supplyAsync(pm25, providerExecutor);

        // Waits for both calls, then reports the temperature failure first.
        return CompletableFuture.allOf(temperatureCall, pm25Call)
                .handle((ignored, error) -> new DailyReading(temperatureCall.join(), pm25Call.join()));
    }
}
