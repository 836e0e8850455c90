// services/recommender/src/main/java/dev/devanks/recommender/model/CurrentLocation.java
package dev.devanks.recommender.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where the traveller is now. Not required to be a tracked district.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentLocation {

    @NotNull(message = "current_location lat and long are required")
    @DecimalMin(value = "-90.0", message = "current_location lat must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "current_location lat must be between -90 and 90")
    @JsonProperty("lat")
    private Double lat;

    @NotNull(message = "current_location lat and long are required")
    @DecimalMin(value = "-180.0", message = "current_location long must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "current_location long must be between -180 and 180")
    @JsonProperty("long")
    private Double lon;

    @JsonProperty("name")
    private String name;
}
