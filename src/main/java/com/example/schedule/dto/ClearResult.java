package com.example.schedule.dto;

import java.time.LocalDate;
import java.util.Set;

/**
 * @param deleted          slots removed from {@code from} onwards
 * @param keptWorkingDates dates left working because they still hold booked slots
 */
public record ClearResult(LocalDate from, int deleted, Set<LocalDate> keptWorkingDates) {
}
