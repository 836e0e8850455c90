// services/recommender/src/main/java/dev/devanks/recommender/client/OpenMeteoForecastClient.java
package dev.devanks.recommender.client;

import dev.devanks.recommender.config.OpenMeteoClientConfig;
import dev.devanks.recommender.model.ForecastResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for the Open-Meteo weather forecast API.
 */
@FeignClient(name = "open-meteo-forecast",
        url = "${recommender.provider.forecast-url}",
        configuration = OpenMeteoClientConfig.class)
public interface OpenMeteoForecastClient {

    /**
     * Hourly series for the provider's default 7-day window.
     */
    @GetMapping("/v1/forecast")
    ForecastResponse getHourly(@RequestParam("latitude") String latitude,
                               @RequestParam("longitude") String longitude,
                               @RequestParam("hourly") String hourly,
                               @RequestParam("timezone") String timezone);

    /**
     * Hourly series bounded to {@code startDate}..{@code endDate} (YYYY-MM-DD, inclusive).
     */
    @GetMapping("/v1/forecast")
    ForecastResponse getHourlyBetween(@RequestParam("latitude") String latitude,
                                      @RequestParam("longitude") String longitude,
                                      @RequestParam("hourly") String hourly,
                                      @RequestParam("start_date") String startDate,
                                      @RequestParam("end_date") String endDate,
                                      @RequestParam("timezone") String timezone);
}
