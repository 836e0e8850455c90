// services/recommender/src/main/java/dev/devanks/recommender/model/CacheEntry.java
package dev.devanks.recommender.model;

import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Ranked snapshot held by the destination cache. Replaced as a whole on every refresh, never edited.
 */
@Value
public class CacheEntry {
    @NonNull
    List<DestinationWeather> destinations;
    @NonNull
    Instant computedAt;

    public Duration age(Instant now) {
        return Duration.between(computedAt, now);
    }
}
