package com.qualitysentinel.core.seasonality;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Calendar cycle a seasonal pattern repeats over, and how a timestamp maps to
 * one of its buckets.
 *
 * <ul>
 * <li>{@link #DAILY}: {@code night} 0-5h, {@code morning} 6-11h,
 * {@code afternoon} 12-17h, {@code evening} 18-23h</li>
 * <li>{@link #WEEKLY}: day of week, {@code sunday} .. {@code saturday}</li>
 * <li>{@link #MONTHLY}: week of month, {@code week1} .. {@code week5} split at
 * days 7, 14, 21 and 28</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum SeasonalPeriod {

    DAILY(List.of("night", "morning", "afternoon", "evening")),
    WEEKLY(List.of("sunday", "monday", "tuesday", "wednesday", "thursday", "friday", "saturday")),
    MONTHLY(List.of("week1", "week2", "week3", "week4", "week5"));

    private final List<String> bucketKeys;

    SeasonalPeriod(List<String> bucketKeys) {
        this.bucketKeys = bucketKeys;
    }

    /** @return every bucket key, in calendar order */
    public List<String> bucketKeys() {
        return bucketKeys;
    }

    /**
     * @param time local calendar time of the sample
     * @return bucket key the sample falls into
     */
    public String bucketOf(ZonedDateTime time) {
        return switch (this) {
            case DAILY -> bucketKeys.get(time.getHour() / 6);
            // DayOfWeek is 1 = Monday .. 7 = Sunday
            case WEEKLY -> bucketKeys.get(time.getDayOfWeek().getValue() % 7);
            case MONTHLY -> bucketKeys.get(Math.min(4, (time.getDayOfMonth() - 1) / 7));
        };
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
