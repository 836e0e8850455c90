// services/recommender/src/main/java/dev/devanks/recommender/exception/ProviderDataException.java
package dev.devanks.recommender.exception;

import dev.devanks.recommender.model.ProviderKind;
import lombok.Getter;

/**
 * The provider answered, but the body was unusable.
 */
@Getter
public class ProviderDataException extends RecommenderException {

    public enum Kind {
        /** Body did not decode into the expected hourly schema. */
        DECODE,
        /** No sample matched the configured hour of day. */
        NO_DATA
    }

    private final ProviderKind provider;
    private final Kind kind;

    public ProviderDataException(ProviderKind provider, Kind kind, String message) {
        super(message);
        this.provider = provider;
        this.kind = kind;
    }

    public ProviderDataException(ProviderKind provider, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
    }
}
