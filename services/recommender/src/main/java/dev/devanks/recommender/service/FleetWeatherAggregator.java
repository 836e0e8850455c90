// services/recommender/src/main/java/dev/devanks/recommender/service/FleetWeatherAggregator.java
package dev.devanks.recommender.service;

import dev.devanks.recommender.config.RecommenderProperties;
import dev.devanks.recommender.exception.RecommenderException;
import dev.devanks.recommender.model.DestinationWeather;
import dev.devanks.recommender.model.District;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

import static dev.devanks.recommender.config.AppConfig.POINT_EXECUTOR;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Aggregates every tracked district with a bounded number in flight, drops the ones that fail and ranks
 * the rest. Best effort: a district failure never fails the fleet.
 */
@Service
@Slf4j
public class FleetWeatherAggregator {

    private final DistrictWeatherAggregator districtAggregator;
    private final DestinationRanker ranker;
    private final ExecutorService pointExecutor;
    private final int maxConcurrentPoints;

    public FleetWeatherAggregator(DistrictWeatherAggregator districtAggregator,
                                  DestinationRanker ranker,
                                  @Qualifier(POINT_EXECUTOR) ExecutorService pointExecutor,
                                  RecommenderProperties properties) {
        this.districtAggregator = districtAggregator;
        this.ranker = ranker;
        this.pointExecutor = pointExecutor;
        this.maxConcurrentPoints = properties.getFleet().getMaxConcurrentPoints();
    }

    /**
     * @param districts districts to aggregate
     * @param budget    time after which districts not yet admitted or finished are dropped
     * @return ranked top-N of the districts that succeeded, possibly empty
     */
    public List<DestinationWeather> aggregateAll(List<District> districts, Duration budget) {
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + budget.toNanos();
        log.info("Aggregating weather for {} districts ({} at a time, budget {} ms).",
                districts.size(), maxConcurrentPoints, budget.toMillis());

        Semaphore admissionGate = new Semaphore(maxConcurrentPoints);
        CompletionService<PointOutcome> outcomes = new ExecutorCompletionService<>(pointExecutor);
        List<Future<PointOutcome>> submitted = new ArrayList<>(districts.size());
        // one slot per input position; equal records then rank in input order
        DestinationWeather[] collected = new DestinationWeather[districts.size()];
        int succeeded = 0;
        int failed = 0;

        try {
            for (int position = 0; position < districts.size(); position++) {
                District district = districts.get(position);
                if (!admissionGate.tryAcquire(deadlineNanos - System.nanoTime(), NANOSECONDS)) {
                    log.warn("Budget exhausted before admitting district {}; {} districts not started.",
                            district.getName(), districts.size() - submitted.size());
                    break;
                }
                submitted.add(submit(outcomes, admissionGate, position, district));
            }

            for (int drained = 0; drained < submitted.size(); drained++) {
                Future<PointOutcome> done = outcomes.poll(deadlineNanos - System.nanoTime(), NANOSECONDS);
                if (done == null) {
                    log.warn("Budget exhausted with {} districts still running; dropping them.",
                            submitted.size() - drained);
                    break;
                }
                PointOutcome outcome = outcomeOf(done);
                if (outcome.isSuccess()) {
                    collected[outcome.getPosition()] = outcome.getWeather();
                    succeeded++;
                } else {
                    failed++;
                    log.warn("Error fetching data for {}: {}", outcome.getDistrict().getName(),
                            outcome.getFailure().getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecommenderException("Interrupted while aggregating district weather", e);
        } finally {
            submitted.forEach(future -> future.cancel(true));
        }

        long elapsedMillis = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        log.info("Aggregated {} of {} districts in {} ms ({} failed).",
                succeeded, districts.size(), elapsedMillis, failed);

        List<DestinationWeather> inDistrictOrder = new ArrayList<>(succeeded);
        for (DestinationWeather weather : collected) {
            if (weather != null) {
                inDistrictOrder.add(weather);
            }
        }
        return ranker.rank(inDistrictOrder);
    }

    private Future<PointOutcome> submit(CompletionService<PointOutcome> outcomes, Semaphore admissionGate,
                                        int position, District district) {
        try {
            return outcomes.submit(() -> {
                try {
                    return PointOutcome.success(position, district, districtAggregator.aggregate(district));
                } catch (RuntimeException e) {
                    return PointOutcome.failure(position, district, e);
                } finally {
                    admissionGate.release();
                }
            });
        } catch (RejectedExecutionException e) {
            admissionGate.release();
            throw new RecommenderException("District aggregation executor rejected " + district.getName(), e);
        }
    }

    private static PointOutcome outcomeOf(Future<PointOutcome> done) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            throw new RecommenderException("District aggregation task failed unexpectedly", e.getCause());
        }
    }
}
