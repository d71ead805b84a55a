package com.enterprise.jobscheduling.schedule;

import com.enterprise.jobscheduling.core.Frequency;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Cron-style recurrence of minute, hour, day-of-month, month and day-of-week fields.
 * A null field matches any value and renders as {@code *}.
 */
public final class RecurrenceRule {

    public static final String ANY = "*";

    // Longest gap between two matches is 29 February to 29 February
    private static final int MAX_SCAN_DAYS = 366 * 8 + 1;

    private final Frequency frequency;
    private final int minute;
    private final Integer hour;
    private final Integer dayOfMonth;
    private final Integer month;
    private final DayOfWeek dayOfWeek;

    private RecurrenceRule(Frequency frequency, int minute, Integer hour, Integer dayOfMonth,
                           Integer month, DayOfWeek dayOfWeek) {
        this.frequency = frequency;
        this.minute = minute;
        this.hour = hour;
        this.dayOfMonth = dayOfMonth;
        this.month = month;
        this.dayOfWeek = dayOfWeek;
    }

    /**
     * Derive the rule for a frequency from the minute/hour/day/month components of a reference time
     */
    public static RecurrenceRule of(Frequency frequency, ZonedDateTime reference) {
        Objects.requireNonNull(frequency, "frequency");
        int m = reference.getMinute();
        int h = reference.getHour();
        switch (frequency) {
            case HOURLY:
                return new RecurrenceRule(frequency, m, null, null, null, null);
            case DAILY:
                return new RecurrenceRule(frequency, m, h, null, null, null);
            case WEEKLY:
                return new RecurrenceRule(frequency, m, h, null, null, reference.getDayOfWeek());
            case MONTHLY:
                return new RecurrenceRule(frequency, m, h, reference.getDayOfMonth(), null, null);
            case YEARLY:
                return new RecurrenceRule(frequency, m, h, reference.getDayOfMonth(),
                                          reference.getMonthValue(), null);
            default:
                throw new IllegalArgumentException("Unsupported frequency: " + frequency);
        }
    }

    public Frequency getFrequency() { return frequency; }

    public String getMinute() { return Integer.toString(minute); }

    public String getHour() { return field(hour); }

    public String getDayOfMonth() { return field(dayOfMonth); }

    public String getMonthOfYear() { return field(month); }

    /**
     * Day of week in cron numbering, 0 is Sunday
     */
    public String getDayOfWeek() {
        return dayOfWeek == null ? ANY : Integer.toString(dayOfWeek.getValue() % 7);
    }

    /**
     * Render as a five field cron pattern understood by cron4j
     */
    public String toCronPattern() {
        return String.join(" ", getMinute(), getHour(), getDayOfMonth(), getMonthOfYear(), getDayOfWeek());
    }

    public boolean matches(ZonedDateTime time) {
        return time.getMinute() == minute
            && (hour == null || time.getHour() == hour)
            && matchesDate(time.toLocalDate());
    }

    /**
     * First instant strictly after {@code after} whose wall-clock time in {@code zone} matches this rule
     */
    public Instant nextFireTime(Instant after, ZoneId zone) {
        ZonedDateTime start = after.atZone(zone);

        if (hour == null) {
            ZonedDateTime candidate = start.truncatedTo(ChronoUnit.HOURS).withMinute(minute);
            if (!candidate.toInstant().isAfter(after)) {
                candidate = candidate.plusHours(1);
            }
            return candidate.toInstant();
        }

        LocalTime time = LocalTime.of(hour, minute);
        LocalDate date = start.toLocalDate();
        for (int i = 0; i < MAX_SCAN_DAYS; i++, date = date.plusDays(1)) {
            if (!matchesDate(date)) {
                continue;
            }
            Instant candidate = ZonedDateTime.of(date, time, zone).toInstant();
            if (candidate.isAfter(after)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No fire time found for rule " + toCronPattern());
    }

    private boolean matchesDate(LocalDate date) {
        return (dayOfMonth == null || date.getDayOfMonth() == dayOfMonth)
            && (month == null || date.getMonthValue() == month)
            && (dayOfWeek == null || date.getDayOfWeek() == dayOfWeek);
    }

    private static String field(Integer value) {
        return value == null ? ANY : value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecurrenceRule)) return false;
        RecurrenceRule other = (RecurrenceRule) o;
        return frequency == other.frequency && toCronPattern().equals(other.toCronPattern());
    }

    @Override
    public int hashCode() {
        return Objects.hash(frequency, toCronPattern());
    }

    @Override
    public String toString() {
        return frequency + " [" + toCronPattern() + "]";
    }
}
