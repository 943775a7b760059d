package com.company.sentinel.util;

import java.time.*;

public class TimeUtils {

    private TimeUtils() {
    }

    /**
     * Calendar day an instant falls on in the given zone
     */
    public static LocalDate dayOf(Instant instant, ZoneId zone) {
        if (instant == null) return null;
        return instant.atZone(zone).toLocalDate();
    }

    public static Instant startOfDay(LocalDate day, ZoneId zone) {
        return day.atStartOfDay(zone).toInstant();
    }

    /**
     * First day whose raw results are kept. Everything before its start
     * is folded into daily stats and purged.
     */
    public static LocalDate retentionCutoffDay(Instant now, Duration keepRaw, ZoneId zone) {
        return dayOf(now.minus(keepRaw), zone);
    }

    public static double nanosToMillis(long nanos) {
        return Math.round(nanos / 1_000.0) / 1_000.0;
    }


    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

        long hours = durationMs / 3600000;
        long minutes = (durationMs % 3600000) / 60000;
        long seconds = (durationMs % 60000) / 1000;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else if (seconds > 0) {
            return String.format("%ds", seconds);
        } else {
            return String.format("%dms", durationMs);
        }
    }
}
