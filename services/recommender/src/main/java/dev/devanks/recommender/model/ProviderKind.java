// services/recommender/src/main/java/dev/devanks/recommender/model/ProviderKind.java
package dev.devanks.recommender.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The two upstream Open-Meteo feeds and the hourly field each one is asked for.
 */
@Getter
@RequiredArgsConstructor
public enum ProviderKind {
    TEMPERATURE("temperature_2m", "temperature", "weather API"),
    AIR_QUALITY("pm2_5", "PM2.5", "air quality API");

    private final String hourlyField;
    private final String label;
    private final String apiName;
}
