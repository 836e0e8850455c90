// services/recommender/src/main/java/dev/devanks/recommender/web/RecommendationController.java
package dev.devanks.recommender.web;

import com.google.common.base.Stopwatch;
import dev.devanks.recommender.config.RecommenderProperties;
import dev.devanks.recommender.model.ApiResponse;
import dev.devanks.recommender.model.CacheEntry;
import dev.devanks.recommender.model.TopDestinations;
import dev.devanks.recommender.model.TravelAdvisory;
import dev.devanks.recommender.model.TravelRequest;
import dev.devanks.recommender.service.CachedDestinationService;
import dev.devanks.recommender.service.TravelAdvisoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.TimeUnit;

@RestController
@RequiredArgsConstructor
@Slf4j
public class RecommendationController {

    static final String RESPONSE_TIME_HEADER = "X-Response-Time";
    static final String TOP_DESCRIPTION =
            "Top %d coolest and cleanest districts by 7-day average temperature and PM2.5 at 2PM";

    private final CachedDestinationService cachedDestinationService;
    private final TravelAdvisoryService travelAdvisoryService;
    private final RecommenderProperties properties;

    @GetMapping("/health")
    public ApiResponse<Map<String, String>> health() {
        return ApiResponse.of(Map.of("status", "healthy"));
    }

    @GetMapping("/api/v1/destinations/top")
    public ResponseEntity<ApiResponse<TopDestinations>> topDestinations() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        CacheEntry entry = cachedDestinationService.getTopDestinations(properties.getCache().getRequestTimeout());
        TopDestinations body = TopDestinations.builder()
                .generatedAt(entry.getComputedAt().toString())
                .description(String.format(TOP_DESCRIPTION, properties.getFleet().getTopN()))
                .destinations(entry.getDestinations())
                .build();
        log.debug("Served {} top destinations in {}", body.getDestinations().size(), stopwatch);
        return ResponseEntity.ok()
                .header(RESPONSE_TIME_HEADER, elapsed(stopwatch))
                .body(ApiResponse.of(body));
    }

    @PostMapping("/api/v1/travel/recommendation")
    public ResponseEntity<ApiResponse<TravelAdvisory>> travelRecommendation(@Valid @RequestBody TravelRequest request) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        TravelAdvisory advisory = travelAdvisoryService.getRecommendation(request);
        return ResponseEntity.ok()
                .header(RESPONSE_TIME_HEADER, elapsed(stopwatch))
                .body(ApiResponse.of(advisory));
    }

    private static String elapsed(Stopwatch stopwatch) {
        return stopwatch.elapsed(TimeUnit.MILLISECONDS) + "ms";
    }
}
