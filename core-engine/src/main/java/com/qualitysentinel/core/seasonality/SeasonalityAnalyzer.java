package com.qualitysentinel.core.seasonality;

import com.qualitysentinel.core.model.DataPoint;
import com.qualitysentinel.core.stats.Statistics;
import com.qualitysentinel.core.stats.SummaryStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.MonthDay;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Detects daily, weekly and monthly multiplicative cycles and applies them as
 * adjustment factors.
 *
 * <h3>Detection</h3>
 * <p>
 * For each period the analyzer groups values by calendar bucket and computes
 * {@code adjustment = bucketMean / overallMean}. The pattern's strength is
 * {@code min(1, 2 * rms(adjustment - 1))} over non-empty buckets, and only
 * patterns stronger than {@value #MIN_PATTERN_STRENGTH} are kept. A period is
 * only examined once the data spans three of its cycles.
 * </p>
 *
 * <h3>Time zone</h3>
 * <p>
 * Buckets are computed in the {@link ZoneId} given at construction, UTC by
 * default, so results do not depend on the JVM's default zone.
 * </p>
 *
 * <p>
 * Stateless apart from the zone; thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalityAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalityAnalyzer.class);

    public static final int DEFAULT_MIN_DATA_POINTS = 14;

    static final double MIN_PATTERN_STRENGTH = 0.3;
    static final double MIN_PEAK_CORRELATION = 0.3;
    static final double DEFAULT_HOLIDAY_FACTOR = 0.5;

    private static final long MS_PER_DAY = Duration.ofDays(1).toMillis();
    private static final long MS_PER_WEEK = 7 * MS_PER_DAY;
    private static final long MS_PER_MONTH = 30 * MS_PER_DAY;

    private static final Set<MonthDay> FIXED_HOLIDAYS = Set.of(
            MonthDay.of(1, 1),
            MonthDay.of(7, 4),
            MonthDay.of(12, 25));

    private final ZoneId zone;

    public SeasonalityAnalyzer() {
        this(ZoneOffset.UTC);
    }

    public SeasonalityAnalyzer(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public SeasonalAnalysisResult analyze(List<DataPoint> data) {
        return analyze(data, DEFAULT_MIN_DATA_POINTS);
    }

    /**
     * Look for seasonal patterns in a time-ordered series.
     *
     * @param data          time-ordered series
     * @param minDataPoints below this many points nothing is detected
     * @return detected patterns, possibly none
     */
    public SeasonalAnalysisResult analyze(List<DataPoint> data, int minDataPoints) {
        Objects.requireNonNull(data, "data must not be null");
        if (data.size() < minDataPoints || data.isEmpty()) {
            return SeasonalAnalysisResult.NONE;
        }

        long span = data.get(data.size() - 1).getTimestamp() - data.get(0).getTimestamp();
        List<SeasonalPattern> patterns = new ArrayList<>();
        double maxStrength = 0;
        SeasonalPeriod dominant = null;

        Map<SeasonalPeriod, Long> minimumSpan = new LinkedHashMap<>();
        minimumSpan.put(SeasonalPeriod.DAILY, 3 * MS_PER_DAY);
        minimumSpan.put(SeasonalPeriod.WEEKLY, 3 * MS_PER_WEEK);
        minimumSpan.put(SeasonalPeriod.MONTHLY, 3 * MS_PER_MONTH);

        for (Map.Entry<SeasonalPeriod, Long> e : minimumSpan.entrySet()) {
            if (span < e.getValue()) {
                continue;
            }
            Map<String, Double> adjustments = new LinkedHashMap<>();
            double strength = detectPattern(data, e.getKey(), adjustments);
            if (strength > MIN_PATTERN_STRENGTH) {
                patterns.add(new SeasonalPattern(e.getKey(), adjustments));
                if (strength > maxStrength) {
                    maxStrength = strength;
                    dominant = e.getKey();
                }
            }
        }

        if (!patterns.isEmpty()) {
            LOG.debug("Detected {} seasonal pattern(s), dominant={} strength={}",
                    patterns.size(), dominant, maxStrength);
        }
        return new SeasonalAnalysisResult(patterns, maxStrength, dominant);
    }

    /**
     * Compute per-bucket adjustments for one period.
     *
     * @param adjustments filled with one entry per bucket key
     * @return pattern strength in {@code [0, 1]}
     */
    double detectPattern(List<DataPoint> data, SeasonalPeriod period, Map<String, Double> adjustments) {
        Map<String, List<Double>> buckets = new HashMap<>();
        double sum = 0;
        for (DataPoint p : data) {
            buckets.computeIfAbsent(period.bucketOf(toLocal(p.getTimestamp())), k -> new ArrayList<>())
                    .add(p.getValue());
            sum += p.getValue();
        }
        double overallMean = sum / data.size();

        double variance = 0;
        int count = 0;
        for (String key : period.bucketKeys()) {
            List<Double> values = buckets.get(key);
            if (values == null || values.isEmpty()) {
                adjustments.put(key, 1.0);
                continue;
            }
            double bucketMean = Statistics.mean(Statistics.toArray(values));
            double adjustment = overallMean != 0 ? bucketMean / overallMean : 1.0;
            adjustments.put(key, adjustment);
            variance += (adjustment - 1) * (adjustment - 1);
            count++;
        }
        return count > 1 ? Math.min(1, Math.sqrt(variance / count) * 2) : 0;
    }

    /**
     * Combined multiplicative adjustment for a timestamp.
     *
     * @return product of the matching bucket adjustments, {@code 1} when the
     *         config is inactive
     */
    public double getAdjustment(long timestamp, SeasonalityConfig config) {
        if (config == null || !config.isActive()) {
            return 1.0;
        }
        ZonedDateTime local = toLocal(timestamp);
        double total = 1.0;
        for (SeasonalPattern pattern : config.getPatterns()) {
            total *= pattern.adjustmentFor(pattern.getPeriod().bucketOf(local));
        }
        return total;
    }

    /** Remove seasonality; a zero adjustment leaves the value unchanged. */
    public double deseasonalize(double value, long timestamp, SeasonalityConfig config) {
        double adjustment = getAdjustment(timestamp, config);
        return adjustment != 0 ? value / adjustment : value;
    }

    public double reseasonalize(double value, long timestamp, SeasonalityConfig config) {
        return value * getAdjustment(timestamp, config);
    }

    /**
     * Autocorrelation for lags {@code 1..maxLag}.
     *
     * @return empty unless the series has at least {@code maxLag + 10} points
     */
    public List<LagCorrelation> autocorrelation(List<DataPoint> data, int maxLag) {
        if (data.size() < maxLag + 10) {
            return List.of();
        }
        double[] values = new double[data.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = data.get(i).getValue();
        }
        SummaryStats stats = Statistics.summarize(values);
        double variance = stats.getStdDev() * stats.getStdDev();

        List<LagCorrelation> out = new ArrayList<>(maxLag);
        for (int lag = 1; lag <= maxLag; lag++) {
            double sum = 0;
            int count = 0;
            for (int i = 0; i < values.length - lag; i++) {
                sum += (values[i] - stats.getMean()) * (values[i + lag] - stats.getMean());
                count++;
            }
            out.add(new LagCorrelation(lag, Statistics.safeDivide(sum, count * variance)));
        }
        return out;
    }

    /**
     * Strongest local autocorrelation peak above 0.3, mapped to a cycle type
     * by lag ({@code <= 7} daily, {@code <= 14} weekly, else monthly).
     */
    public Optional<CycleInfo> findDominantCycle(List<DataPoint> data) {
        List<LagCorrelation> acf = autocorrelation(data, 60);
        LagCorrelation strongest = null;
        for (int i = 1; i < acf.size() - 1; i++) {
            double c = acf.get(i).getCorrelation();
            if (c > acf.get(i - 1).getCorrelation()
                    && c > acf.get(i + 1).getCorrelation()
                    && c > MIN_PEAK_CORRELATION
                    && (strongest == null || c > strongest.getCorrelation())) {
                strongest = acf.get(i);
            }
        }
        if (strongest == null) {
            return Optional.empty();
        }
        SeasonalPeriod type;
        if (strongest.getLag() <= 7) {
            type = SeasonalPeriod.DAILY;
        } else if (strongest.getLag() <= 14) {
            type = SeasonalPeriod.WEEKLY;
        } else {
            type = SeasonalPeriod.MONTHLY;
        }
        double avgInterval = (double) (data.get(data.size() - 1).getTimestamp() - data.get(0).getTimestamp())
                / (data.size() - 1);
        return Optional.of(new CycleInfo(strongest.getLag() * avgInterval, strongest.getCorrelation(), type));
    }

    /** Fixed-date holidays only: 1 January, 4 July and 25 December. */
    public boolean isHoliday(long timestamp) {
        return FIXED_HOLIDAYS.contains(MonthDay.from(toLocal(timestamp)));
    }

    public double getHolidayAdjustment(long timestamp) {
        return getHolidayAdjustment(timestamp, DEFAULT_HOLIDAY_FACTOR);
    }

    public double getHolidayAdjustment(long timestamp, double holidayFactor) {
        return isHoliday(timestamp) ? holidayFactor : 1.0;
    }

    public ZoneId getZone() {
        return zone;
    }

    private ZonedDateTime toLocal(long timestamp) {
        return Instant.ofEpochMilli(timestamp).atZone(zone);
    }
}
