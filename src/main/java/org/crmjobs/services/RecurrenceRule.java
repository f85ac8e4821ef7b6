package org.crmjobs.services;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

/**
 * Cron-like recurrence with three fields: minute, hour and day of week.
 * Each field is either ANY, a fixed value, or a step ("every N", counted from 0).
 * Evaluation is pure: a rule never looks at a clock on its own.
 *
 * Literal form used in config.xml: "MINUTE HOUR DAY_OF_WEEK"
 *      "0 2 SUN"    every Sunday at 02:00
 *      "0 6 MON"    every Monday at 06:00
 *      "&#42;/5 * *"  every five minutes
 *      "0 8 *"      every day at 08:00
 */
public final class RecurrenceRule {

    // a week plus a day covers every weekly rule
    private static final long SEARCH_LIMIT_MINUTES = 8L * 24 * 60;

    private final Field minute;
    private final Field hour;
    private final Field dayOfWeek;

    public RecurrenceRule(Field minute, Field hour, Field dayOfWeek) {
        this.minute = Objects.requireNonNull(minute, "minute");
        this.hour = Objects.requireNonNull(hour, "hour");
        this.dayOfWeek = Objects.requireNonNull(dayOfWeek, "dayOfWeek");
        minute.validate("minute", 0, 59);
        hour.validate("hour", 0, 23);
        dayOfWeek.validate("dayOfWeek", 1, 7);
    }

    public static RecurrenceRule weekly(DayOfWeek day, int hour, int minute) {
        return new RecurrenceRule(Field.at(minute), Field.at(hour), Field.at(day.getValue()));
    }

    public static RecurrenceRule daily(int hour, int minute) {
        return new RecurrenceRule(Field.at(minute), Field.at(hour), Field.any());
    }

    public static RecurrenceRule everyMinutes(int step) {
        return new RecurrenceRule(Field.every(step), Field.any(), Field.any());
    }

    public static RecurrenceRule everyHours(int step) {
        return new RecurrenceRule(Field.at(0), Field.every(step), Field.any());
    }

    /**
     * Parses the three-field literal. Day of week accepts 1-7 (Monday = 1) or
     * the English three-letter abbreviation.
     */
    public static RecurrenceRule parse(String literal) {
        if (literal == null || literal.isBlank()) {
            throw new IllegalArgumentException("Recurrence literal is empty");
        }
        String[] parts = literal.trim().split("\\s+");
        if (parts.length != 3) {
            throw new IllegalArgumentException(
                    "Recurrence literal must have 3 fields (minute hour dayOfWeek): '" + literal + "'");
        }
        return new RecurrenceRule(
                parseField(parts[0], false),
                parseField(parts[1], false),
                parseField(parts[2], true));
    }

    private static Field parseField(String token, boolean dayOfWeek) {
        if ("*".equals(token)) {
            return Field.any();
        }
        if (token.startsWith("*/")) {
            return Field.every(parseNumber(token.substring(2), token));
        }
        if (dayOfWeek && !Character.isDigit(token.charAt(0))) {
            return Field.at(parseDay(token).getValue());
        }
        return Field.at(parseNumber(token, token));
    }

    private static int parseNumber(String value, String token) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid recurrence field '" + token + "'", e);
        }
    }

    private static DayOfWeek parseDay(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().startsWith(upper) && upper.length() >= 3) {
                return day;
            }
        }
        throw new IllegalArgumentException("Invalid day of week '" + token + "'");
    }

    /**
     * True when the wall-clock minute of the given time satisfies every field.
     * Seconds are ignored.
     */
    public boolean matches(ZonedDateTime time) {
        return matches(time.toLocalDateTime());
    }

    private boolean matches(LocalDateTime local) {
        return minute.matches(local.getMinute())
                && hour.matches(local.getHour())
                && dayOfWeek.matches(local.getDayOfWeek().getValue());
    }

    /**
     * True when the rule matches this minute, or matches a wall-clock minute skipped by a
     * daylight-saving gap that ends at this minute. "0 2 SUN" in America/New_York is therefore
     * due at 03:00 on the Sunday the clocks spring forward.
     */
    public boolean isDue(ZonedDateTime minuteStart) {
        if (matches(minuteStart)) {
            return true;
        }
        LocalDateTime local = minuteStart.toLocalDateTime();
        LocalDateTime skipped = minuteStart.minusMinutes(1).toLocalDateTime().plusMinutes(1);
        for (; skipped.isBefore(local); skipped = skipped.plusMinutes(1)) {
            if (matches(skipped)) {
                return true;
            }
        }
        return false;
    }

    /**
     * First matching minute strictly after the given time, or null if none within eight days
     * (only possible for a rule that can never match, which the constructor already prevents).
     */
    public ZonedDateTime nextMatch(ZonedDateTime after) {
        ZonedDateTime candidate = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        for (long i = 0; i < SEARCH_LIMIT_MINUTES; i++) {
            if (isDue(candidate)) {
                return candidate;
            }
            candidate = candidate.plusMinutes(1);
        }
        return null;
    }

    public Field minute() { return minute; }
    public Field hour() { return hour; }
    public Field dayOfWeek() { return dayOfWeek; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecurrenceRule)) return false;
        RecurrenceRule that = (RecurrenceRule) o;
        return minute.equals(that.minute) && hour.equals(that.hour) && dayOfWeek.equals(that.dayOfWeek);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minute, hour, dayOfWeek);
    }

    @Override
    public String toString() {
        String day = dayOfWeek.kind == Kind.FIXED
                ? DayOfWeek.of(dayOfWeek.value).getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toUpperCase(Locale.ROOT)
                : dayOfWeek.toString();
        return minute + " " + hour + " " + day;
    }

    public enum Kind { ANY, FIXED, EVERY }

    /**
     * One field of a rule.
     */
    public static final class Field {
        private static final Field ANY = new Field(Kind.ANY, 0);

        private final Kind kind;
        private final int value;

        private Field(Kind kind, int value) {
            this.kind = kind;
            this.value = value;
        }

        public static Field any() { return ANY; }
        public static Field at(int value) { return new Field(Kind.FIXED, value); }
        public static Field every(int step) { return new Field(Kind.EVERY, step); }

        public Kind kind() { return kind; }
        public int value() { return value; }

        boolean matches(int candidate) {
            switch (kind) {
                case ANY:
                    return true;
                case FIXED:
                    return candidate == value;
                case EVERY:
                    return candidate % value == 0;
                default:
                    throw new IllegalStateException("Unknown field kind " + kind);
            }
        }

        void validate(String name, int min, int max) {
            if (kind == Kind.FIXED && (value < min || value > max)) {
                throw new IllegalArgumentException(name + " must be between " + min + " and " + max + ", got " + value);
            }
            if (kind == Kind.EVERY && (value < 1 || value > max)) {
                throw new IllegalArgumentException(name + " step must be between 1 and " + max + ", got " + value);
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Field)) return false;
            Field field = (Field) o;
            return kind == field.kind && value == field.value;
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, value);
        }

        @Override
        public String toString() {
            switch (kind) {
                case ANY:
                    return "*";
                case EVERY:
                    return "*/" + value;
                default:
                    return Integer.toString(value);
            }
        }
    }
}
