// services/recommender/src/main/java/dev/devanks/recommender/model/GeoData.java
package dev.devanks.recommender.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeoData {

    private List<RawDistrict> districts = new ArrayList<>();
}
