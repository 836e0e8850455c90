// services/recommender/src/main/java/dev/devanks/recommender/exception/ProviderTransportException.java
package dev.devanks.recommender.exception;

import dev.devanks.recommender.model.ProviderKind;
import lombok.Getter;

/**
 * The provider could not be reached or answered with a non-success status.
 */
@Getter
public class ProviderTransportException extends RecommenderException {

    public static final int NO_STATUS = -1;

    private final ProviderKind provider;
    private final int status;

    public ProviderTransportException(ProviderKind provider, int status, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.status = status;
    }
}
