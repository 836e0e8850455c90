// services/recommender/src/main/java/dev/devanks/recommender/service/DestinationRanker.java
package dev.devanks.recommender.service;

import dev.devanks.recommender.config.RecommenderProperties;
import dev.devanks.recommender.model.DestinationWeather;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders destinations coolest first, cleaner air breaking temperature ties, and keeps the top N.
 */
@Component
@RequiredArgsConstructor
public class DestinationRanker {

    static final Comparator<DestinationWeather> COOLEST_THEN_CLEANEST =
            Comparator.comparingDouble(DestinationWeather::getAvgTemp2pmCelsius)
                    .thenComparingDouble(DestinationWeather::getAvgPm25);

    private final RecommenderProperties properties;

    /**
     * Returns at most {@code top-n} copies of the input, ranked 1..k. Equal keys keep their input order.
     * The input records are left untouched.
     */
    public List<DestinationWeather> rank(List<DestinationWeather> destinations) {
        List<DestinationWeather> sorted = new ArrayList<>(destinations.size());
        for (DestinationWeather destination : destinations) {
            sorted.add(destination.copy());
        }
        // List.sort is stable
        sorted.sort(COOLEST_THEN_CLEANEST);

        int limit = Math.min(properties.getFleet().getTopN(), sorted.size());
        List<DestinationWeather> top = new ArrayList<>(sorted.subList(0, limit));
        for (int i = 0; i < top.size(); i++) {
            top.get(i).setRank(i + 1);
        }
        return top;
    }
}
