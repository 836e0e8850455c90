// services/recommender/src/main/java/dev/devanks/recommender/model/TopDestinations.java
package dev.devanks.recommender.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TopDestinations {

    @JsonProperty("generated_at")
    String generatedAt;

    @JsonProperty("description")
    String description;

    @JsonProperty("destinations")
    List<DestinationWeather> destinations;
}
