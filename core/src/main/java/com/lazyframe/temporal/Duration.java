package com.lazyframe.temporal;

import com.lazyframe.exception.InvalidOperationException;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A calendar-aware duration written in the interval language used by upsampling and
 * as-of join tolerances.
 *
 * <p>A duration is a sequence of {@code <integer><unit>} terms with an optional leading
 * minus sign, for example {@code 3d12h4m25s}. Supported units:
 * <ul>
 *   <li>{@code ns}, {@code us}, {@code ms}, {@code s}, {@code m}, {@code h} - fixed length</li>
 *   <li>{@code d} - calendar day, {@code w} - calendar week</li>
 *   <li>{@code mo} - calendar month, {@code q} - calendar quarter, {@code y} - calendar year</li>
 * </ul>
 *
 * <p>Calendar units move the wall-clock date: one month after January 31 is the last day
 * of February. A bare {@code 0} is the zero duration.
 */
public final class Duration {

    private static final long NANOS_PER_MICRO = 1_000L;
    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final long NANOS_PER_MINUTE = 60 * NANOS_PER_SECOND;
    private static final long NANOS_PER_HOUR = 60 * NANOS_PER_MINUTE;

    private final long months;
    private final long weeks;
    private final long days;
    private final long nanos;
    private final boolean negative;
    private final String text;

    private Duration(long months, long weeks, long days, long nanos, boolean negative, String text) {
        this.months = months;
        this.weeks = weeks;
        this.days = days;
        this.nanos = nanos;
        this.negative = negative;
        this.text = text;
    }

    /**
     * Parses a duration string.
     *
     * @param text the duration, e.g. {@code 15m} or {@code -1mo2d}
     * @return the parsed duration
     * @throws InvalidOperationException if the string is malformed
     */
    public static Duration parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String s = text.trim();
        if (s.equals("0")) {
            return new Duration(0, 0, 0, 0, false, "0");
        }
        boolean negative = s.startsWith("-");
        int pos = negative ? 1 : 0;
        if (pos >= s.length()) {
            throw invalid(text, "empty duration");
        }

        long months = 0;
        long weeks = 0;
        long days = 0;
        long nanos = 0;
        while (pos < s.length()) {
            int start = pos;
            while (pos < s.length() && Character.isDigit(s.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                throw invalid(text, "expected a number at position " + pos);
            }
            long amount;
            try {
                amount = Long.parseLong(s.substring(start, pos));
            } catch (NumberFormatException e) {
                throw new InvalidOperationException("invalid duration '" + text + "': number out of range", e);
            }
            int unitStart = pos;
            while (pos < s.length() && Character.isLetter(s.charAt(pos))) {
                pos++;
            }
            String unit = s.substring(unitStart, pos);
            switch (unit) {
                case "ns" -> nanos += amount;
                case "us" -> nanos += amount * NANOS_PER_MICRO;
                case "ms" -> nanos += amount * NANOS_PER_MILLI;
                case "s" -> nanos += amount * NANOS_PER_SECOND;
                case "m" -> nanos += amount * NANOS_PER_MINUTE;
                case "h" -> nanos += amount * NANOS_PER_HOUR;
                case "d" -> days += amount;
                case "w" -> weeks += amount;
                case "mo" -> months += amount;
                case "q" -> months += amount * 3;
                case "y" -> months += amount * 12;
                case "" -> throw invalid(text, "missing unit after " + amount);
                default -> throw invalid(text, "unknown unit '" + unit + "'");
            }
        }
        return new Duration(months, weeks, days, nanos, negative, s);
    }

    private static InvalidOperationException invalid(String text, String reason) {
        return new InvalidOperationException("invalid duration '" + text + "': " + reason
            + " (expected terms like 1ns, 1us, 1ms, 1s, 1m, 1h, 1d, 1w, 1mo, 1q, 1y)");
    }

    /**
     * Adds this duration to a timestamp.
     *
     * @param timestamp the timestamp
     * @return the shifted timestamp
     */
    public LocalDateTime addTo(LocalDateTime timestamp) {
        long sign = negative ? -1 : 1;
        LocalDateTime result = timestamp;
        if (months != 0) {
            result = result.plusMonths(sign * months);
        }
        if (weeks != 0 || days != 0) {
            result = result.plusDays(sign * (weeks * 7 + days));
        }
        if (nanos != 0) {
            result = result.plusNanos(sign * nanos);
        }
        return result;
    }

    /**
     * Subtracts this duration from a timestamp.
     *
     * @param timestamp the timestamp
     * @return the shifted timestamp
     */
    public LocalDateTime subtractFrom(LocalDateTime timestamp) {
        return negated().addTo(timestamp);
    }

    /**
     * Returns the duration with the opposite sign.
     *
     * @return the negated duration
     */
    public Duration negated() {
        if (isZero()) {
            return this;
        }
        String negatedText = negative ? text.substring(1) : "-" + text;
        return new Duration(months, weeks, days, nanos, !negative, negatedText);
    }

    public boolean isZero() {
        return months == 0 && weeks == 0 && days == 0 && nanos == 0;
    }

    public boolean isNegative() {
        return negative && !isZero();
    }

    /**
     * Returns true if the duration moves timestamps forward.
     *
     * @return true for a strictly positive duration
     */
    public boolean isPositive() {
        return !negative && !isZero();
    }

    public long months() {
        return months;
    }

    public long weeks() {
        return weeks;
    }

    public long days() {
        return days;
    }

    public long nanos() {
        return nanos;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Duration)) return false;
        Duration that = (Duration) obj;
        return months == that.months && weeks == that.weeks && days == that.days
            && nanos == that.nanos && isNegative() == that.isNegative();
    }

    @Override
    public int hashCode() {
        return Objects.hash(months, weeks, days, nanos, isNegative());
    }

    @Override
    public String toString() {
        return text;
    }
}
