// services/recommender/src/main/java/dev/devanks/recommender/service/CacheState.java
package dev.devanks.recommender.service;

/**
 * Lifecycle of the top-destinations cache.
 * <pre>
 * EMPTY --refresh--> REFRESHING --success--> FRESH --ttl elapses--> STALE --refresh--> REFRESHING
 * </pre>
 * Readers arriving while REFRESHING get the last snapshot if one exists.
 */
public enum CacheState {
    EMPTY,
    FRESH,
    STALE,
    REFRESHING
}
