// services/recommender/src/main/java/dev/devanks/recommender/model/District.java
package dev.devanks.recommender.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A tracked district with parsed coordinates. Read-only once loaded.
 */
@Value
@Builder
public class District {
    @NonNull
    String id;
    String divisionId;
    @NonNull
    String name;
    String bnName;
    double lat;
    double lon;
}
