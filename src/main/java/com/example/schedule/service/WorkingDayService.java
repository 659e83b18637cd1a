package com.example.schedule.service;

import com.example.schedule.store.WorkingDayStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Per-date working flag. Independent of slot existence: a working day may be empty,
 * and the flag survives the deletion of the day's last slot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkingDayService {

    private final WorkingDayStore store;

    public Map<LocalDate, Boolean> workingDays(String providerId) {
        return store.get(providerId);
    }

    public boolean isWorkingDay(String providerId, LocalDate date) {
        return Boolean.TRUE.equals(store.get(providerId).get(date));
    }

    public void setWorkingDay(String providerId, LocalDate date, boolean working) {
        setWorkingDays(providerId, Set.of(date), working);
    }

    public void setWorkingDays(String providerId, Collection<LocalDate> dates, boolean working) {
        store.setDates(providerId, dates, working);
        log.info("Provider {}: {} marked as {}", providerId, dates, working ? "working" : "off");
    }

    /** Turns off every date on or after {@code from}, except {@code keep}. */
    public void clearFrom(String providerId, LocalDate from, Set<LocalDate> keep) {
        store.clearFrom(providerId, from, keep);
        log.info("Provider {}: working days from {} cleared, kept {}", providerId, from, keep);
    }
}
