// services/recommender/src/main/java/dev/devanks/recommender/exception/TravelValidationException.java
package dev.devanks.recommender.exception;

import lombok.Getter;

@Getter
public class TravelValidationException extends RecommenderException {

    public enum Reason {
        INVALID_DATE_FORMAT,
        DATE_OUT_OF_RANGE,
        UNKNOWN_DESTINATION,
        MISSING_FIELD
    }

    private final Reason reason;

    public TravelValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
