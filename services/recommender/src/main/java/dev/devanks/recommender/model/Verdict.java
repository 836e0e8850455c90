// services/recommender/src/main/java/dev/devanks/recommender/model/Verdict.java
package dev.devanks.recommender.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum Verdict {
    RECOMMENDED("Recommended"),
    NOT_RECOMMENDED("Not Recommended");

    private final String displayName;

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
}
