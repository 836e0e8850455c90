// services/recommender/src/main/java/dev/devanks/recommender/model/HourlySeries.java
package dev.devanks.recommender.model;

import java.util.List;

/**
 * Positionally aligned hourly timestamps and values, as returned by both Open-Meteo endpoints.
 */
public interface HourlySeries {

    List<String> getTime();

    List<Double> getValues();
}
