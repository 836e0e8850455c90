// services/recommender/src/main/java/dev/devanks/recommender/service/PointOutcome.java
package dev.devanks.recommender.service;

import dev.devanks.recommender.model.DestinationWeather;
import dev.devanks.recommender.model.District;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of aggregating one district during a fleet refresh: either a record or the failure that dropped it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PointOutcome {
    /** Index of the district in the fleet input. */
    int position;
    District district;
    DestinationWeather weather;
    Throwable failure;

    public static PointOutcome success(int position, District district, DestinationWeather weather) {
        return new PointOutcome(position, district, weather, null);
    }

    public static PointOutcome failure(int position, District district, Throwable failure) {
        return new PointOutcome(position, district, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
