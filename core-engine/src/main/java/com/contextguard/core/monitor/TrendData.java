package com.contextguard.core.monitor;

import java.util.Arrays;

/**
 * Accumulated milliseconds per hour of day (24), day of week (7, Sunday
 * first) and week of month (4).
 *
 * @since 1.0.0
 */
public final class TrendData {

    static final int HOURS = 24;
    static final int DAYS = 7;
    static final int WEEKS = 4;

    private final long[] hourly;
    private final long[] daily;
    private final long[] weekly;

    TrendData(long[] hourly, long[] daily, long[] weekly) {
        this.hourly = hourly.clone();
        this.daily = daily.clone();
        this.weekly = weekly.clone();
    }

    public long[] getHourly() {
        return hourly.clone();
    }

    public long[] getDaily() {
        return daily.clone();
    }

    public long[] getWeekly() {
        return weekly.clone();
    }

    @Override
    public String toString() {
        return "TrendData{" +
                "hourly=" + Arrays.toString(hourly) +
                ", daily=" + Arrays.toString(daily) +
                ", weekly=" + Arrays.toString(weekly) +
                '}';
    }
}
