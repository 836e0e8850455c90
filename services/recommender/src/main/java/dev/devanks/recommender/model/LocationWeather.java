// services/recommender/src/main/java/dev/devanks/recommender/model/LocationWeather.java
package dev.devanks.recommender.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LocationWeather {

    @JsonProperty("name")
    String name;

    @JsonProperty("temp_2pm_celsius")
    double temp2pmCelsius;

    @JsonProperty("pm25")
    double pm25;
}
