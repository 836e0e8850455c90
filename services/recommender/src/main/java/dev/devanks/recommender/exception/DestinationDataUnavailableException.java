// services/recommender/src/main/java/dev/devanks/recommender/exception/DestinationDataUnavailableException.java
package dev.devanks.recommender.exception;

public class DestinationDataUnavailableException extends RecommenderException {
    public DestinationDataUnavailableException(String message) {
        super(message);
    }

    public DestinationDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
