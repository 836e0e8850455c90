// services/recommender/src/main/java/dev/devanks/recommender/exception/RecommenderException.java
package dev.devanks.recommender.exception;

public class RecommenderException extends RuntimeException {
    public RecommenderException(String message) {
        super(message);
    }

    public RecommenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
