// services/recommender/src/main/java/dev/devanks/recommender/model/RawDistrict.java
package dev.devanks.recommender.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * District entry as stored in the bundled data file. Coordinates are kept as strings there.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawDistrict {

    @JsonProperty("id")
    private String id;

    @JsonProperty("division_id")
    private String divisionId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("bn_name")
    private String bnName;

    @JsonProperty("lat")
    private String lat;

    @JsonProperty("long")
    private String lon;
}
