// services/recommender/src/main/java/dev/devanks/recommender/service/FutureResults.java
package dev.devanks.recommender.service;

import dev.devanks.recommender.exception.RecommenderException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Helpers for waiting on provider futures and surfacing the original failure.
 */
final class FutureResults {

    private FutureResults() {
    }

    static <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecommenderException("Interrupted while waiting for provider data", e);
        }
    }

    static RuntimeException unwrap(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new RecommenderException(cause.getMessage(), cause);
    }
}
