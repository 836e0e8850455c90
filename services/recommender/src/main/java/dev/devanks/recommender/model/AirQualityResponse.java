// services/recommender/src/main/java/dev/devanks/recommender/model/AirQualityResponse.java
package dev.devanks.recommender.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AirQualityResponse {

    @JsonProperty("hourly")
    private Hourly hourly;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Hourly implements HourlySeries {

        @JsonProperty("time")
        private List<String> time;

        @JsonProperty("pm2_5")
        private List<Double> pm25;

        @Override
        @JsonIgnore
        public List<Double> getValues() {
            return pm25;
        }
    }
}
