// services/recommender/src/main/java/dev/devanks/recommender/model/DailyReading.java
package dev.devanks.recommender.model;

import lombok.Value;

/**
 * Temperature and PM2.5 sampled at the same hour of day, both rounded to two decimals.
 */
@Value
public class DailyReading {
    double temperatureCelsius;
    double pm25;
}
