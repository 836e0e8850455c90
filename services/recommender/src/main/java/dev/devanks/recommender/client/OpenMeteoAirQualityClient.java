// services/recommender/src/main/java/dev/devanks/recommender/client/OpenMeteoAirQualityClient.java
package dev.devanks.recommender.client;

import dev.devanks.recommender.config.OpenMeteoClientConfig;
import dev.devanks.recommender.model.AirQualityResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for the Open-Meteo air quality API.
 */
@FeignClient(name = "open-meteo-air-quality",
        url = "${recommender.provider.air-quality-url}",
        configuration = OpenMeteoClientConfig.class)
public interface OpenMeteoAirQualityClient {

    @GetMapping("/v1/air-quality")
    AirQualityResponse getHourly(@RequestParam("latitude") String latitude,
                                 @RequestParam("longitude") String longitude,
                                 @RequestParam("hourly") String hourly,
                                 @RequestParam("timezone") String timezone);

    @GetMapping("/v1/air-quality")
    AirQualityResponse getHourlyBetween(@RequestParam("latitude") String latitude,
                                        @RequestParam("longitude") String longitude,
                                        @RequestParam("hourly") String hourly,
                                        @RequestParam("start_date") String startDate,
                                        @RequestParam("end_date") String endDate,
                                        @RequestParam("timezone") String timezone);
}
