package com.elssolution.powermonitor.aggregation;

import java.time.*;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bucket width of a query result. Minute and hour buckets are plain multiples
 * of the epoch; day, week and month buckets follow the calendar of the given
 * zone so they stay aligned across DST changes and uneven month lengths.
 */
public record Resolution(Unit unit, int amount) {

    public enum Unit { NONE, AUTO, MINUTE, HOUR, DAY, WEEK, MONTH }

    public static final Resolution NONE = new Resolution(Unit.NONE, 0);
    public static final Resolution AUTO = new Resolution(Unit.AUTO, 0);

    private static final long MINUTE_MS = 60_000L;
    private static final Pattern FORMAT = Pattern.compile("(\\d*)\\s*([a-z]+)");

    public Resolution {
        if (unit == null) throw new IllegalArgumentException("unit");
        if ((unit == Unit.NONE || unit == Unit.AUTO) ? amount != 0 : amount < 1) {
            throw new IllegalArgumentException("Bad amount " + amount + " for " + unit);
        }
        if ((unit == Unit.WEEK || unit == Unit.MONTH) && amount != 1) {
            throw new IllegalArgumentException("Only single " + unit + " buckets are supported");
        }
    }

    public static Resolution minutes(int n) { return new Resolution(Unit.MINUTE, n); }
    public static Resolution hours(int n)   { return new Resolution(Unit.HOUR, n); }
    public static Resolution days(int n)    { return new Resolution(Unit.DAY, n); }
    public static Resolution week()         { return new Resolution(Unit.WEEK, 1); }
    public static Resolution month()        { return new Resolution(Unit.MONTH, 1); }

    /**
     * Parses labels such as {@code none}, {@code auto}, {@code 5min}, {@code 1hour},
     * {@code 2h}, {@code 3days}, {@code 1week}, {@code month}. Blank means {@code auto}.
     */
    public static Resolution parse(String text) {
        if (text == null || text.isBlank()) return AUTO;
        String s = text.trim().toLowerCase(Locale.ROOT);
        if (s.equals("none") || s.equals("raw")) return NONE;
        if (s.equals("auto")) return AUTO;

        Matcher m = FORMAT.matcher(s);
        if (!m.matches()) throw bad(text);
        int n;
        try {
            n = m.group(1).isEmpty() ? 1 : Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw bad(text);
        }
        Unit unit = switch (m.group(2)) {
            case "m", "min", "mins", "minute", "minutes" -> Unit.MINUTE;
            case "h", "hour", "hours" -> Unit.HOUR;
            case "d", "day", "days" -> Unit.DAY;
            case "w", "week", "weeks" -> Unit.WEEK;
            case "mo", "month", "months" -> Unit.MONTH;
            default -> throw bad(text);
        };
        try {
            return new Resolution(unit, n);
        } catch (IllegalArgumentException e) {
            throw bad(text);
        }
    }

    public boolean isRaw()  { return unit == Unit.NONE; }
    public boolean isAuto() { return unit == Unit.AUTO; }

    /**
     * Nominal width in minutes. Months count as 30 days; that figure is only
     * used to pick a resolution, never to place a bucket boundary.
     */
    public long widthMinutes() {
        return switch (unit) {
            case MINUTE -> amount;
            case HOUR -> amount * 60L;
            case DAY -> amount * 1_440L;
            case WEEK -> 10_080L;
            case MONTH -> 43_200L;
            case NONE, AUTO -> 0L;
        };
    }

    /** Start of the bucket containing {@code t}. */
    public Instant bucketStart(Instant t, ZoneId zone) {
        return switch (unit) {
            case MINUTE, HOUR -> {
                long width = widthMinutes() * MINUTE_MS;
                yield Instant.ofEpochMilli(Math.floorDiv(t.toEpochMilli(), width) * width);
            }
            case DAY -> {
                long epochDay = LocalDate.ofInstant(t, zone).toEpochDay();
                yield LocalDate.ofEpochDay(epochDay - Math.floorMod(epochDay, (long) amount))
                        .atStartOfDay(zone).toInstant();
            }
            case WEEK -> LocalDate.ofInstant(t, zone)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY))
                    .atStartOfDay(zone).toInstant();
            case MONTH -> LocalDate.ofInstant(t, zone).withDayOfMonth(1).atStartOfDay(zone).toInstant();
            case NONE, AUTO -> throw new IllegalStateException(unit + " has no buckets");
        };
    }

    /** Start of the bucket after the one starting at {@code start}. */
    public Instant next(Instant start, ZoneId zone) {
        return switch (unit) {
            case MINUTE, HOUR -> start.plusMillis(widthMinutes() * MINUTE_MS);
            case DAY -> LocalDate.ofInstant(start, zone).plusDays(amount).atStartOfDay(zone).toInstant();
            case WEEK -> LocalDate.ofInstant(start, zone).plusWeeks(1).atStartOfDay(zone).toInstant();
            case MONTH -> LocalDate.ofInstant(start, zone).plusMonths(1).atStartOfDay(zone).toInstant();
            case NONE, AUTO -> throw new IllegalStateException(unit + " has no buckets");
        };
    }

    public String label() {
        return switch (unit) {
            case NONE -> "none";
            case AUTO -> "auto";
            case MINUTE -> amount + "min";
            case HOUR -> amount + "hour";
            case DAY -> amount + "day";
            case WEEK -> "1week";
            case MONTH -> "1month";
        };
    }

    @Override
    public String toString() {
        return label();
    }

    private static QueryException bad(String text) {
        return new QueryException(QueryException.Reason.BAD_RESOLUTION, "Unsupported resolution '" + text + "'");
    }
}
