// services/recommender/src/main/java/dev/devanks/recommender/mapper/HourlySeriesReducer.java
package dev.devanks.recommender.mapper;

import dev.devanks.recommender.config.RecommenderProperties;
import dev.devanks.recommender.exception.ProviderDataException;
import dev.devanks.recommender.model.HourlySeries;
import dev.devanks.recommender.model.ProviderKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

import static dev.devanks.recommender.exception.ProviderDataException.Kind.DECODE;
import static dev.devanks.recommender.exception.ProviderDataException.Kind.NO_DATA;

/**
 * Reduces an hourly provider series to one representative value: the mean of every sample taken at the
 * configured hour of day, rounded to two decimals.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HourlySeriesReducer {

    // "2025-12-25T14:00" -> "14"
    private static final int HOUR_BEGIN = 11;
    private static final int HOUR_END = 13;

    private final RecommenderProperties properties;

    public double reduce(ProviderKind provider, HourlySeries series) {
        if (series == null || series.getTime() == null || series.getValues() == null) {
            throw new ProviderDataException(provider, DECODE,
                    provider.getApiName() + " response has no hourly " + provider.getHourlyField() + " series");
        }

        int sampleHour = properties.getProvider().getSampleHour();
        String hourToken = String.format(Locale.ROOT, "%02d", sampleHour);
        List<String> times = series.getTime();
        List<Double> values = series.getValues();

        double sum = 0.0;
        int samples = 0;
        for (int i = 0; i < times.size(); i++) {
            String time = times.get(i);
            if (time == null || time.length() < HOUR_END || !hourToken.equals(time.substring(HOUR_BEGIN, HOUR_END))) {
                continue;
            }
            if (i >= values.size() || values.get(i) == null) {
                log.debug("Skipping {} sample at {} without a value.", provider.getLabel(), time);
                continue;
            }
            sum += values.get(i);
            samples++;
        }

        if (samples == 0) {
            throw new ProviderDataException(provider, NO_DATA,
                    "no " + hourLabel(sampleHour) + " " + provider.getLabel() + " data found");
        }
        return roundTwoDecimals(sum / samples);
    }

    public static double roundTwoDecimals(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    static String hourLabel(int hour) {
        if (hour == 0) {
            return "12AM";
        }
        if (hour < 12) {
            return hour + "AM";
        }
        return (hour == 12 ? 12 : hour - 12) + "PM";
    }
}
