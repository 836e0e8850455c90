// services/recommender/src/main/java/dev/devanks/recommender/model/TravelRequest.java
package dev.devanks.recommender.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TravelRequest {

    @Valid
    @NotNull(message = "current_location lat and long are required")
    @JsonProperty("current_location")
    private CurrentLocation currentLocation;

    @NotBlank(message = "destination_district_name is required")
    @JsonProperty("destination_district_name")
    private String destinationDistrictName;

    @NotBlank(message = "travel_date is required (format: YYYY-MM-DD)")
    @JsonProperty("travel_date")
    private String travelDate;
}
