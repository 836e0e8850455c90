// services/recommender/src/main/java/dev/devanks/recommender/client/OpenMeteoProviderClient.java
package dev.devanks.recommender.client;

import dev.devanks.recommender.exception.ProviderDataException;
import dev.devanks.recommender.exception.ProviderTransportException;
import dev.devanks.recommender.mapper.HourlySeriesReducer;
import dev.devanks.recommender.model.AirQualityResponse;
import dev.devanks.recommender.model.ForecastResponse;
import dev.devanks.recommender.model.HourlySeries;
import dev.devanks.recommender.model.ProviderKind;
import feign.FeignException;
import feign.codec.DecodeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Locale;
import java.util.function.Supplier;

import static dev.devanks.recommender.exception.ProviderDataException.Kind.DECODE;
import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE;

/**
 * Fetches one provider's hourly series for one location and reduces it to a single daily value.
 * One outbound call per invocation, no retries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenMeteoProviderClient {

    static final String TIMEZONE_AUTO = "auto";

    private final OpenMeteoForecastClient forecastClient;
    private final OpenMeteoAirQualityClient airQualityClient;
    private final HourlySeriesReducer reducer;

    /**
     * Value over the provider's default 7-day forecast window.
     */
    public double fetchDaily(ProviderKind provider, double lat, double lon) {
        String latitude = formatCoordinate(lat);
        String longitude = formatCoordinate(lon);
        log.debug("Fetching 7-day {} for ({}, {}).", provider.getLabel(), latitude, longitude);

        HourlySeries series = call(provider, () -> provider == ProviderKind.TEMPERATURE
                ? hourlyOf(forecastClient.getHourly(latitude, longitude, provider.getHourlyField(), TIMEZONE_AUTO))
                : hourlyOf(airQualityClient.getHourly(latitude, longitude, provider.getHourlyField(), TIMEZONE_AUTO)));
        return reducer.reduce(provider, series);
    }

    /**
     * Value for a single calendar day.
     */
    public double fetchDaily(ProviderKind provider, double lat, double lon, LocalDate date) {
        String latitude = formatCoordinate(lat);
        String longitude = formatCoordinate(lon);
        String day = date.format(ISO_LOCAL_DATE);
        log.debug("Fetching {} for ({}, {}) on {}.", provider.getLabel(), latitude, longitude, day);

        HourlySeries series = call(provider, () -> provider == ProviderKind.TEMPERATURE
                ? hourlyOf(forecastClient.getHourlyBetween(latitude, longitude, provider.getHourlyField(), day, day, TIMEZONE_AUTO))
                : hourlyOf(airQualityClient.getHourlyBetween(latitude, longitude, provider.getHourlyField(), day, day, TIMEZONE_AUTO)));
        return reducer.reduce(provider, series);
    }

    static String formatCoordinate(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private HourlySeries call(ProviderKind provider, Supplier<HourlySeries> request) {
        try {
            return request.get();
        } catch (DecodeException e) {
            log.warn("{} returned a body that could not be decoded: {}", provider.getApiName(), e.getMessage());
            throw new ProviderDataException(provider, DECODE,
                    provider.getApiName() + " returned an unreadable body: " + e.getMessage(), e);
        } catch (FeignException e) {
            int status = e.status() > 0 ? e.status() : ProviderTransportException.NO_STATUS;
            String message = status == ProviderTransportException.NO_STATUS
                    ? provider.getApiName() + " request failed: " + e.getMessage()
                    : provider.getApiName() + " returned status " + status;
            log.warn("{} call failed (Feign): Status={}, Message={}", provider.getApiName(), e.status(), e.getMessage());
            throw new ProviderTransportException(provider, status, message, e);
        }
    }

    private static HourlySeries hourlyOf(ForecastResponse response) {
        return response == null ? null : response.getHourly();
    }

    private static HourlySeries hourlyOf(AirQualityResponse response) {
        return response == null ? null : response.getHourly();
    }
}
