// services/recommender/src/main/java/dev/devanks/recommender/service/CachedDestinationService.java
package dev.devanks.recommender.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.devanks.recommender.config.RecommenderProperties;
import dev.devanks.recommender.exception.DeadlineExceededException;
import dev.devanks.recommender.exception.DestinationDataUnavailableException;
import dev.devanks.recommender.exception.RecommenderException;
import dev.devanks.recommender.model.CacheEntry;
import dev.devanks.recommender.model.DestinationWeather;
import dev.devanks.recommender.model.District;
import dev.devanks.recommender.repository.DistrictRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Time-to-live cache in front of the fleet aggregation.
 *
 * <p>At most one fleet-wide refresh runs at a time. While it runs, readers get the previous snapshot if
 * there is one; readers with nothing to fall back on wait for that same refresh. Every read returns an
 * independent copy of the cached records.
 */
@Service
@Slf4j
public class CachedDestinationService implements AutoCloseable {

    private final DistrictRepository districtRepository;
    private final FleetWeatherAggregator fleetAggregator;
    private final Clock clock;
    private final Duration ttl;
    private final Duration refreshBudget;
    private final Duration backgroundTimeout;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ExecutorService refreshExecutor;
    private final ScheduledExecutorService scheduler;

    // guarded by lock
    private CacheEntry entry;
    private CompletableFuture<CacheEntry> inFlight;

    public CachedDestinationService(RecommenderProperties properties,
                                    DistrictRepository districtRepository,
                                    FleetWeatherAggregator fleetAggregator,
                                    Clock clock) {
        RecommenderProperties.CacheProperties cache = properties.getCache();
        Preconditions.checkArgument(!cache.getTtl().isNegative() && !cache.getTtl().isZero(),
                "recommender.cache.ttl must be positive, was %s", cache.getTtl());
        this.districtRepository = districtRepository;
        this.fleetAggregator = fleetAggregator;
        this.clock = clock;
        this.ttl = cache.getTtl();
        this.refreshBudget = cache.getRefreshBudget();
        this.backgroundTimeout = cache.getBackgroundTimeout();
        this.refreshExecutor = Executors.newSingleThreadExecutor(daemonThreads("destination-refresh-%d"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("destination-refresh-timer-%d"));
    }

    /**
     * Ranked top destinations and the time they were computed.
     *
     * @param timeout how long to wait when a refresh is needed
     * @throws DeadlineExceededException if nothing is cached and the refresh does not finish in time
     */
    public CacheEntry getTopDestinations(Duration timeout) {
        lock.readLock().lock();
        try {
            if (isFresh(entry)) {
                log.debug("Destination cache hit (computed at {}).", entry.getComputedAt());
                return copyOf(entry);
            }
        } finally {
            lock.readLock().unlock();
        }

        CompletableFuture<CacheEntry> refresh;
        lock.writeLock().lock();
        try {
            // another caller may have refreshed while we waited for the write lock
            if (isFresh(entry)) {
                return copyOf(entry);
            }
            if (inFlight != null) {
                if (entry != null) {
                    log.debug("Refresh in progress, serving snapshot from {}.", entry.getComputedAt());
                    return copyOf(entry);
                }
                refresh = inFlight;
            } else {
                refresh = startRefresh();
            }
        } finally {
            lock.writeLock().unlock();
        }
        return awaitRefresh(refresh, timeout);
    }

    /**
     * Populates the cache before the first real request.
     */
    public void warm(Duration timeout) {
        CacheEntry warmed = getTopDestinations(timeout);
        log.info("Destination cache warmed with {} destinations.", warmed.getDestinations().size());
    }

    /**
     * Refreshes the cache every {@code ttl / 2} so it is renewed before readers see it expire. Cancel the
     * returned future (or {@link #close()} the cache) to stop.
     */
    public ScheduledFuture<?> startBackgroundRefresh() {
        Duration interval = ttl.dividedBy(2);
        log.info("Starting background destination refresh every {} ms.", interval.toMillis());
        return scheduler.scheduleAtFixedRate(this::backgroundRefresh,
                interval.toNanos(), interval.toNanos(), NANOSECONDS);
    }

    public CacheState state() {
        lock.readLock().lock();
        try {
            if (inFlight != null) {
                return CacheState.REFRESHING;
            }
            if (entry == null) {
                return CacheState.EMPTY;
            }
            return isFresh(entry) ? CacheState.FRESH : CacheState.STALE;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        log.info("Stopping destination cache refresh.");
        scheduler.shutdownNow();
        refreshExecutor.shutdownNow();
    }

    @VisibleForTesting
    void backgroundRefresh() {
        CompletableFuture<CacheEntry> refresh;
        lock.writeLock().lock();
        try {
            if (inFlight != null) {
                log.debug("Background refresh skipped, a refresh is already running.");
                return;
            }
            if (entry != null && entry.age(clock.instant()).compareTo(ttl.dividedBy(2)) < 0) {
                log.debug("Background refresh skipped, snapshot from {} is recent.", entry.getComputedAt());
                return;
            }
            refresh = startRefresh();
        } finally {
            lock.writeLock().unlock();
        }

        try {
            CacheEntry refreshed = refresh.get(backgroundTimeout.toNanos(), NANOSECONDS);
            log.info("Background refresh stored {} destinations.", refreshed.getDestinations().size());
        } catch (TimeoutException e) {
            log.warn("Background refresh still running after {} ms.", backgroundTimeout.toMillis());
        } catch (ExecutionException e) {
            log.warn("Background refresh failed: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @VisibleForTesting
    void seed(List<DestinationWeather> destinations, Instant computedAt) {
        lock.writeLock().lock();
        try {
            entry = new CacheEntry(List.copyOf(destinations), computedAt);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private CompletableFuture<CacheEntry> startRefresh() {
        CompletableFuture<CacheEntry> refresh = new CompletableFuture<>();
        inFlight = refresh;
        try {
            refreshExecutor.execute(() -> runRefresh(refresh));
        } catch (RejectedExecutionException e) {
            inFlight = null;
            refresh.completeExceptionally(new RecommenderException("Destination refresh could not be scheduled", e));
        }
        return refresh;
    }

    private void runRefresh(CompletableFuture<CacheEntry> refresh) {
        Instant started = clock.instant();
        CacheEntry refreshed = null;
        RuntimeException failure = null;
        try {
            List<District> districts = districtRepository.findAll();
            List<DestinationWeather> ranked = fleetAggregator.aggregateAll(districts, refreshBudget);
            if (ranked.isEmpty() && !districts.isEmpty()) {
                throw new DestinationDataUnavailableException(
                        "No district returned weather data; keeping previous destinations");
            }
            refreshed = new CacheEntry(List.copyOf(ranked), clock.instant());
        } catch (RuntimeException e) {
            failure = e;
            log.error("Destination refresh failed after {} ms: {}",
                    Duration.between(started, clock.instant()).toMillis(), e.getMessage());
        } finally {
            lock.writeLock().lock();
            try {
                if (refreshed != null) {
                    entry = refreshed;
                }
                inFlight = null;
            } finally {
                lock.writeLock().unlock();
            }
        }

        if (refreshed != null) {
            log.info("Destination cache refreshed with {} destinations in {} ms.",
                    refreshed.getDestinations().size(), Duration.between(started, refreshed.getComputedAt()).toMillis());
            refresh.complete(refreshed);
        } else {
            refresh.completeExceptionally(failure);
        }
    }

    private CacheEntry awaitRefresh(CompletableFuture<CacheEntry> refresh, Duration timeout) {
        try {
            return copyOf(refresh.get(timeout.toNanos(), NANOSECONDS));
        } catch (TimeoutException e) {
            return snapshotOr(() -> new DeadlineExceededException("Top destinations refresh", timeout));
        } catch (ExecutionException e) {
            return snapshotOr(() -> FutureResults.unwrap(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return snapshotOr(() -> new RecommenderException("Interrupted while waiting for top destinations", e));
        }
    }

    private CacheEntry snapshotOr(Supplier<RuntimeException> failure) {
        lock.readLock().lock();
        try {
            if (entry != null) {
                log.warn("Fresh destinations unavailable, serving snapshot from {}.", entry.getComputedAt());
                return copyOf(entry);
            }
        } finally {
            lock.readLock().unlock();
        }
        throw failure.get();
    }

    private boolean isFresh(CacheEntry candidate) {
        return candidate != null && candidate.age(clock.instant()).compareTo(ttl) < 0;
    }

    private static CacheEntry copyOf(CacheEntry source) {
        List<DestinationWeather> copies = new ArrayList<>(source.getDestinations().size());
        for (DestinationWeather destination : source.getDestinations()) {
            copies.add(destination.copy());
        }
        return new CacheEntry(copies, source.getComputedAt());
    }

    private static ThreadFactory daemonThreads(String nameFormat) {
        return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
    }
}
