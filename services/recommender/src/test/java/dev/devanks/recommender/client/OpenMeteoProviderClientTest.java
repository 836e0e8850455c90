// services/recommender/src/test/java/dev/devanks/recommender/client/OpenMeteoProviderClientTest.java
package dev.devanks.recommender.client;

import dev.devanks.recommender.config.RecommenderProperties;
import dev.devanks.recommender.exception.ProviderDataException;
import dev.devanks.recommender.exception.ProviderTransportException;
import dev.devanks.recommender.mapper.HourlySeriesReducer;
import dev.devanks.recommender.model.AirQualityResponse;
import dev.devanks.recommender.model.ForecastResponse;
import dev.devanks.recommender.model.ProviderKind;
import feign.FeignException;
import feign.Request;
import feign.codec.DecodeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenMeteoProviderClientTest {

    private static final Request DUMMY_REQUEST = Request.create(Request.HttpMethod.GET, "/v1/forecast",
            Collections.emptyMap(), null, StandardCharsets.UTF_8, null);

    @Mock
    private OpenMeteoForecastClient mockForecastClient;
    @Mock
    private OpenMeteoAirQualityClient mockAirQualityClient;

    private OpenMeteoProviderClient providerClient;

    @BeforeEach
    void setUp() {
        providerClient = new OpenMeteoProviderClient(mockForecastClient, mockAirQualityClient,
                new HourlySeriesReducer(new RecommenderProperties()));
    }

    @Test
    @DisplayName("fetchDaily - temperature over the 7-day window")
    void fetchDaily_Temperature() {
        // Arrange
        ForecastResponse response = ForecastResponse.builder()
                .hourly(ForecastResponse.Hourly.builder()
                        .time(List.of("2025-01-01T14:00", "2025-01-02T14:00"))
                        .temperature2m(List.of(25.0, 26.0))
                        .build())
                .build();
        when(mockForecastClient.getHourly("23.7115", "90.4111", "temperature_2m", "auto")).thenReturn(response);

        // Act
        double result = providerClient.fetchDaily(ProviderKind.TEMPERATURE, 23.7115253, 90.4111451);

        // Assert
        assertThat(result).isEqualTo(25.5);
        verifyNoInteractions(mockAirQualityClient);
    }

    @Test
    @DisplayName("fetchDaily - PM2.5 for a single date uses start and end date")
    void fetchDaily_AirQualityForDate() {
        AirQualityResponse response = AirQualityResponse.builder()
                .hourly(AirQualityResponse.Hourly.builder()
                        .time(List.of("2025-03-10T14:00"))
                        .pm25(List.of(42.5))
                        .build())
                .build();
        when(mockAirQualityClient.getHourlyBetween("21.4432", "91.9738", "pm2_5", "2025-03-10", "2025-03-10", "auto"))
                .thenReturn(response);

        double result = providerClient.fetchDaily(ProviderKind.AIR_QUALITY, 21.44315751, 91.97381741,
                LocalDate.of(2025, 3, 10));

        assertThat(result).isEqualTo(42.5);
        verify(mockAirQualityClient).getHourlyBetween("21.4432", "91.9738", "pm2_5", "2025-03-10", "2025-03-10", "auto");
    }

    @Test
    @DisplayName("fetchDaily - non-success status maps to ProviderTransportException with the status")
    void fetchDaily_HttpError() {
        FeignException feignException = new FeignException.ServiceUnavailable("Service down", DUMMY_REQUEST, null,
                Collections.emptyMap());
        when(mockForecastClient.getHourly(anyString(), anyString(), anyString(), anyString())).thenThrow(feignException);

        assertThatThrownBy(() -> providerClient.fetchDaily(ProviderKind.TEMPERATURE, 23.7, 90.4))
                .isInstanceOf(ProviderTransportException.class)
                .hasMessage("weather API returned status 503")
                .hasCauseInstanceOf(FeignException.class)
                .extracting("status").isEqualTo(503);
    }

    @Test
    @DisplayName("fetchDaily - connection failure maps to ProviderTransportException without a status")
    void fetchDaily_TransportError() {
        FeignException feignException = new FeignException(-1, "Read timed out executing GET /v1/air-quality",
                new SocketTimeoutException("Read timed out")) {
        };
        when(mockAirQualityClient.getHourly(anyString(), anyString(), anyString(), anyString())).thenThrow(feignException);

        assertThatThrownBy(() -> providerClient.fetchDaily(ProviderKind.AIR_QUALITY, 23.7, 90.4))
                .isInstanceOf(ProviderTransportException.class)
                .hasMessageStartingWith("air quality API request failed")
                .extracting("status").isEqualTo(ProviderTransportException.NO_STATUS);
    }

    @Test
    @DisplayName("fetchDaily - undecodable body maps to ProviderDataException DECODE")
    void fetchDaily_DecodeError() {
        DecodeException decodeException = new DecodeException(200, "Unexpected token", DUMMY_REQUEST);
        when(mockForecastClient.getHourly(anyString(), anyString(), anyString(), anyString())).thenThrow(decodeException);

        assertThatThrownBy(() -> providerClient.fetchDaily(ProviderKind.TEMPERATURE, 23.7, 90.4))
                .isInstanceOf(ProviderDataException.class)
                .extracting("kind").isEqualTo(ProviderDataException.Kind.DECODE);
    }

    @Test
    @DisplayName("fetchDaily - body without an hourly block maps to ProviderDataException DECODE")
    void fetchDaily_MissingHourly() {
        when(mockForecastClient.getHourly(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(new ForecastResponse());

        assertThatThrownBy(() -> providerClient.fetchDaily(ProviderKind.TEMPERATURE, 23.7, 90.4))
                .isInstanceOf(ProviderDataException.class)
                .extracting("kind").isEqualTo(ProviderDataException.Kind.DECODE);
    }

    @Test
    @DisplayName("formatCoordinate - four decimals regardless of locale")
    void formatCoordinate_FourDecimals() {
        assertThat(OpenMeteoProviderClient.formatCoordinate(23.71152)).isEqualTo("23.7115");
        assertThat(OpenMeteoProviderClient.formatCoordinate(-0.5)).isEqualTo("-0.5000");
    }
}
