// services/recommender/src/main/java/dev/devanks/recommender/exception/DeadlineExceededException.java
package dev.devanks.recommender.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * The caller's time budget ran out before the result was available.
 */
@Getter
public class DeadlineExceededException extends RecommenderException {

    private final Duration budget;

    public DeadlineExceededException(String operation, Duration budget) {
        super(operation + " did not complete within " + budget.toMillis() + " ms");
        this.budget = budget;
    }
}
