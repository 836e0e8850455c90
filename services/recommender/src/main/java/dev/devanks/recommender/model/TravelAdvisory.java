// services/recommender/src/main/java/dev/devanks/recommender/model/TravelAdvisory.java
package dev.devanks.recommender.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of comparing the traveller's location with a destination on one day. Computed per request.
 */
@Value
@Builder
public class TravelAdvisory {

    @JsonProperty("recommendation")
    Verdict recommendation;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("travel_date")
    String travelDate;

    @JsonProperty("current_location")
    LocationWeather currentLocation;

    @JsonProperty("destination")
    LocationWeather destination;

    /** Positive when the destination is cooler. */
    @JsonProperty("temp_difference_celsius")
    double tempDifference;

    /** Positive when the destination is cleaner. */
    @JsonProperty("pm25_difference")
    double pm25Difference;
}
