package com.example.schedule.service;

import com.example.schedule.config.ScheduleConfig;
import com.example.schedule.service.exception.ScheduleValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Rolling calendar anchored at today. Page {@code p} covers
 * {@code today + p * daysPerPage} .. {@code today + (p + 1) * daysPerPage - 1}; pages are
 * contiguous and never overlap.
 */
@Component
@RequiredArgsConstructor
public class CalendarWindowing {

    private final Clock clock;
    private final ScheduleConfig config;

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /** Current time of day at minute precision. */
    public LocalTime currentTime() {
        return LocalTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
    }

    public int requirePage(int pageIndex) {
        if (pageIndex < 0 || pageIndex >= config.getMaxPages()) {
            throw new ScheduleValidationException(
                    "Page " + pageIndex + " is outside 0.." + (config.getMaxPages() - 1));
        }
        return pageIndex;
    }

    public LocalDate pageStart(int pageIndex) {
        requirePage(pageIndex);
        return today().plusDays((long) pageIndex * config.getDaysPerPage());
    }

    public LocalDate dateAt(int pageIndex, int offset) {
        if (offset < 0 || offset >= config.getDaysPerPage()) {
            throw new ScheduleValidationException(
                    "Day offset " + offset + " is outside 0.." + (config.getDaysPerPage() - 1));
        }
        return pageStart(pageIndex).plusDays(offset);
    }

    public List<LocalDate> pageDates(int pageIndex) {
        LocalDate start = pageStart(pageIndex);
        return IntStream.range(0, config.getDaysPerPage())
                .mapToObj(start::plusDays)
                .toList();
    }

    /** Last date reachable through page navigation. */
    public LocalDate horizonEnd() {
        return today().plusDays((long) config.getMaxPages() * config.getDaysPerPage() - 1);
    }

    public boolean isPast(LocalDate date) {
        return date.isBefore(today());
    }

    public boolean isBeyondHorizon(LocalDate date) {
        return date.isAfter(horizonEnd());
    }

    /** A start at or before the current minute of today is already due. */
    public boolean isPastDue(LocalDate date, LocalTime start) {
        LocalDate today = today();
        if (date.isBefore(today)) {
            return true;
        }
        return date.equals(today) && !start.truncatedTo(ChronoUnit.MINUTES).isAfter(currentTime());
    }
}
