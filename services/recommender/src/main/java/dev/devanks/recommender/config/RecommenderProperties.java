// services/recommender/src/main/java/dev/devanks/recommender/config/RecommenderProperties.java
package dev.devanks.recommender.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "recommender")
public class RecommenderProperties {

    /**
     * Location of the district list loaded at start-up.
     */
    @NotEmpty
    private String districtsResource = "classpath:data/districts.json";

    @Valid
    @NotNull
    private ProviderProperties provider = new ProviderProperties();

    @Valid
    @NotNull
    private FleetProperties fleet = new FleetProperties();

    @Valid
    @NotNull
    private CacheProperties cache = new CacheProperties();

    @Valid
    @NotNull
    private TravelProperties travel = new TravelProperties();

    @Data
    public static class ProviderProperties {
        @NotEmpty
        @URL
        private String forecastUrl = "https://api.open-meteo.com";
        @NotEmpty
        @URL
        private String airQualityUrl = "https://air-quality-api.open-meteo.com";
        /**
         * Hard bound on a single provider call (connect and read).
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
        /**
         * Local hour of day whose samples represent the day.
         */
        @Min(0)
        @Max(23)
        private int sampleHour = 14;
    }

    @Data
    public static class FleetProperties {
        /**
         * Districts aggregated at the same time.
         */
        @Min(1)
        private int maxConcurrentPoints = 5;
        @Min(1)
        private int topN = 10;
    }

    @Data
    public static class CacheProperties {
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);
        /**
         * Budget of a single top-destinations request.
         */
        @NotNull
        private Duration requestTimeout = Duration.ofMillis(500);
        @NotNull
        private Duration warmupTimeout = Duration.ofSeconds(60);
        /**
         * How long each background cycle waits for its refresh.
         */
        @NotNull
        private Duration backgroundTimeout = Duration.ofSeconds(30);
        /**
         * Time a fleet-wide refresh may run before unfinished districts are dropped.
         */
        @NotNull
        private Duration refreshBudget = Duration.ofSeconds(30);
        private boolean backgroundRefreshEnabled = true;
    }

    @Data
    public static class TravelProperties {
        /**
         * Days ahead of today a travel date may be, inclusive.
         */
        @Min(0)
        @Max(16)
        private int forecastHorizonDays = 7;
        @NotNull
        private Duration timeout = Duration.ofSeconds(15);
        @NotEmpty
        private String defaultCurrentName = "Current Location";
    }
}
