package com.example.schedule.service.util;

import com.example.schedule.service.exception.ScheduleValidationException;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Time-of-day parsing and formatting. Stored times always carry seconds (HH:MM:SS),
 * user input usually does not.
 */
public final class TimeFormat {

    private static final Pattern TIME = Pattern.compile("^(\\d{1,2}):(\\d{1,2})(?::(\\d{1,2}))?$");
    private static final DateTimeFormatter FULL = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter SHORT = DateTimeFormatter.ofPattern("HH:mm");

    private TimeFormat() {
    }

    public static LocalTime parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ScheduleValidationException("Time is required");
        }
        Matcher m = TIME.matcher(value.trim());
        if (!m.matches()) {
            throw new ScheduleValidationException("Invalid time '" + value + "', expected HH:MM");
        }
        try {
            int hours = Integer.parseInt(m.group(1));
            int minutes = Integer.parseInt(m.group(2));
            int seconds = m.group(3) != null ? Integer.parseInt(m.group(3)) : 0;
            return LocalTime.of(hours, minutes, seconds);
        } catch (DateTimeException e) {
            throw new ScheduleValidationException("Invalid time '" + value + "': " + e.getMessage());
        }
    }

    public static LocalTime normalize(LocalTime time) {
        return time.truncatedTo(ChronoUnit.SECONDS);
    }

    /** "9:5" -> "09:05:00". */
    public static String normalize(String value) {
        return format(parse(value));
    }

    public static String format(LocalTime time) {
        return normalize(time).format(FULL);
    }

    public static String formatShort(LocalTime time) {
        return time.format(SHORT);
    }

    public static int minutesOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}
