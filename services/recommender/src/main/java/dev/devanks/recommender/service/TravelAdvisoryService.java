// services/recommender/src/main/java/dev/devanks/recommender/service/TravelAdvisoryService.java
package dev.devanks.recommender.service;

import com.google.common.base.Strings;
import dev.devanks.recommender.config.RecommenderProperties;
import dev.devanks.recommender.exception.DeadlineExceededException;
import dev.devanks.recommender.exception.RecommenderException;
import dev.devanks.recommender.exception.TravelValidationException;
import dev.devanks.recommender.model.CurrentLocation;
import dev.devanks.recommender.model.DailyReading;
import dev.devanks.recommender.model.District;
import dev.devanks.recommender.model.LocationWeather;
import dev.devanks.recommender.model.TravelAdvisory;
import dev.devanks.recommender.model.TravelRequest;
import dev.devanks.recommender.model.Verdict;
import dev.devanks.recommender.repository.DistrictRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static dev.devanks.recommender.exception.TravelValidationException.Reason.DATE_OUT_OF_RANGE;
import static dev.devanks.recommender.exception.TravelValidationException.Reason.INVALID_DATE_FORMAT;
import static dev.devanks.recommender.exception.TravelValidationException.Reason.MISSING_FIELD;
import static dev.devanks.recommender.exception.TravelValidationException.Reason.UNKNOWN_DESTINATION;
import static dev.devanks.recommender.mapper.HourlySeriesReducer.roundTwoDecimals;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Compares the traveller's current location with a destination district on the travel date and decides
 * whether the trip is worth it: the destination must be both cooler and cleaner at 2PM.
 */
@Service
@Slf4j
public class TravelAdvisoryService {

    private final DistrictRepository districtRepository;
    private final DistrictWeatherAggregator weatherAggregator;
    private final AdvisoryReasonFormatter reasonFormatter;
    private final Clock clock;
    private final RecommenderProperties.TravelProperties travel;

    public TravelAdvisoryService(DistrictRepository districtRepository,
                                 DistrictWeatherAggregator weatherAggregator,
                                 AdvisoryReasonFormatter reasonFormatter,
                                 Clock clock,
                                 RecommenderProperties properties) {
        this.districtRepository = districtRepository;
        this.weatherAggregator = weatherAggregator;
        this.reasonFormatter = reasonFormatter;
        this.clock = clock;
        this.travel = properties.getTravel();
    }

    /**
     * @throws TravelValidationException  if the request is invalid; raised before any provider call
     * @throws DeadlineExceededException  if the readings are not available within the travel timeout
     */
    public TravelAdvisory getRecommendation(TravelRequest request) {
        CurrentLocation current = request.getCurrentLocation();
        if (current == null || current.getLat() == null || current.getLon() == null) {
            throw new TravelValidationException(MISSING_FIELD, "current_location lat and long are required");
        }
        if (Strings.nullToEmpty(request.getDestinationDistrictName()).isBlank()) {
            throw new TravelValidationException(MISSING_FIELD, "destination_district_name is required");
        }
        LocalDate travelDate = parseTravelDate(request.getTravelDate());
        District destination = districtRepository.findByName(request.getDestinationDistrictName())
                .orElseThrow(() -> new TravelValidationException(UNKNOWN_DESTINATION, "destination district not found"));
        String currentName = Strings.isNullOrEmpty(current.getName()) ? travel.getDefaultCurrentName() : current.getName();

        log.info("Travel advisory: {} -> {} on {}", currentName, destination.getName(), travelDate);
        CompletableFuture<DailyReading> currentCall =
                weatherAggregator.readingForDateAsync(current.getLat(), current.getLon(), travelDate);
        CompletableFuture<DailyReading> destinationCall =
                weatherAggregator.readingForDateAsync(destination.getLat(), destination.getLon(), travelDate);
        awaitBoth(currentCall, destinationCall);

        // current location failure is reported first
        DailyReading here = FutureResults.await(currentCall);
        DailyReading there = FutureResults.await(destinationCall);

        double tempDifference = roundTwoDecimals(here.getTemperatureCelsius() - there.getTemperatureCelsius());
        double pm25Difference = roundTwoDecimals(here.getPm25() - there.getPm25());
        Verdict verdict = tempDifference > 0 && pm25Difference > 0 ? Verdict.RECOMMENDED : Verdict.NOT_RECOMMENDED;

        log.info("Travel advisory for {}: {} (temp diff {}, pm25 diff {})",
                destination.getName(), verdict.getDisplayName(), tempDifference, pm25Difference);
        return TravelAdvisory.builder()
                .recommendation(verdict)
                .reason(reasonFormatter.format(destination.getName(), tempDifference, pm25Difference, verdict))
                .travelDate(request.getTravelDate())
                .currentLocation(locationWeather(currentName, here))
                .destination(locationWeather(destination.getName(), there))
                .tempDifference(tempDifference)
                .pm25Difference(pm25Difference)
                .build();
    }

    private LocalDate parseTravelDate(String travelDate) {
        LocalDate date;
        try {
            date = LocalDate.parse(Strings.nullToEmpty(travelDate));
        } catch (DateTimeParseException e) {
            throw new TravelValidationException(INVALID_DATE_FORMAT, "invalid travel date format, use YYYY-MM-DD");
        }
        LocalDate today = LocalDate.now(clock);
        if (date.isBefore(today) || date.isAfter(today.plusDays(travel.getForecastHorizonDays()))) {
            throw new TravelValidationException(DATE_OUT_OF_RANGE,
                    "travel date must be within the next " + travel.getForecastHorizonDays() + " days");
        }
        return date;
    }

    private void awaitBoth(CompletableFuture<DailyReading> currentCall, CompletableFuture<DailyReading> destinationCall) {
        Duration timeout = travel.getTimeout();
        try {
            CompletableFuture.allOf(currentCall, destinationCall).get(timeout.toNanos(), NANOSECONDS);
        } catch (ExecutionException e) {
            // failures are surfaced per side, in order
            log.debug("Travel advisory provider call failed: {}", e.getCause().getMessage());
        } catch (TimeoutException e) {
            currentCall.cancel(true);
            destinationCall.cancel(true);
            throw new DeadlineExceededException("Travel advisory", timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecommenderException("Interrupted while waiting for travel advisory data", e);
        }
    }

    private static LocationWeather locationWeather(String name, DailyReading reading) {
        return LocationWeather.builder()
                .name(name)
                .temp2pmCelsius(reading.getTemperatureCelsius())
                .pm25(reading.getPm25())
                .build();
    }
}
