// services/recommender/src/main/java/dev/devanks/recommender/model/DestinationWeather.java
package dev.devanks.recommender.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-district composite of the 7-day 2PM averages. {@code rank} stays 0 until the ranker assigns it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DestinationWeather {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("bn_name")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String bnName;

    @JsonProperty("avg_temp_2pm_celsius")
    private double avgTemp2pmCelsius;

    @JsonProperty("avg_pm25")
    private double avgPm25;

    @JsonProperty("rank")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private int rank;

    public DestinationWeather copy() {
        return toBuilder().build();
    }
}
