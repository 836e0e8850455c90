// services/recommender/src/main/java/dev/devanks/recommender/service/AdvisoryReasonFormatter.java
package dev.devanks.recommender.service;

import dev.devanks.recommender.model.Verdict;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Turns the temperature and PM2.5 differences of an advisory into a short sentence.
 * Differences are {@code current - destination}, so positive means the destination is cooler or cleaner.
 */
@Component
public class AdvisoryReasonFormatter {

    static final double SAME_TEMPERATURE_BELOW = 1.0;
    static final double SLIGHT_TEMPERATURE_UP_TO = 3.0;
    static final double SIMILAR_AIR_BELOW = 5.0;
    static final double MODERATE_AIR_UP_TO = 15.0;

    public String format(String destinationName, double tempDifference, double pm25Difference, Verdict verdict) {
        String sentence = String.format(Locale.ROOT, "%s is %s and has %s.",
                destinationName, temperatureClause(tempDifference), airClause(pm25Difference));
        if (verdict == Verdict.RECOMMENDED) {
            return sentence + " Enjoy your trip!";
        }
        return sentence + " You may want to reconsider this trip.";
    }

    static String temperatureClause(double tempDifference) {
        double magnitude = Math.abs(tempDifference);
        if (magnitude < SAME_TEMPERATURE_BELOW) {
            return "about the same temperature";
        }
        String intensity = magnitude <= SLIGHT_TEMPERATURE_UP_TO ? "slightly" : "significantly";
        String direction = tempDifference > 0 ? "cooler" : "hotter";
        String comparison = tempDifference > 0 ? "less" : "more";
        return String.format(Locale.ROOT, "%s %s (%.1f°C %s)", intensity, direction, magnitude, comparison);
    }

    static String airClause(double pm25Difference) {
        double magnitude = Math.abs(pm25Difference);
        if (magnitude < SIMILAR_AIR_BELOW) {
            return "similar air quality";
        }
        String direction = pm25Difference > 0 ? "better" : "worse";
        if (magnitude <= MODERATE_AIR_UP_TO) {
            return direction + " air quality";
        }
        return "significantly " + direction + " air quality";
    }
}
