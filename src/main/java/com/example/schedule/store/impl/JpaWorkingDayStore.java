package com.example.schedule.store.impl;

import com.example.schedule.model.WorkingDay;
import com.example.schedule.repository.WorkingDayRepository;
import com.example.schedule.service.exception.ScheduleStorageException;
import com.example.schedule.store.WorkingDayStore;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Keeps only the working dates; a day switched off is removed from the table.
 */
@Component
@RequiredArgsConstructor
public class JpaWorkingDayStore implements WorkingDayStore {

    private final WorkingDayRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Map<LocalDate, Boolean> get(String providerId) {
        try {
            Map<LocalDate, Boolean> days = new TreeMap<>();
            repository.findByProviderId(providerId)
                    .forEach(day -> days.put(day.getWorkDate(), day.isWorking()));
            return days;
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to load working days of provider " + providerId, e);
        }
    }

    @Override
    @Transactional
    public void setDates(String providerId, Collection<LocalDate> dates, boolean working) {
        if (dates.isEmpty()) {
            return;
        }
        try {
            List<WorkingDay> existing = repository.findByProviderIdAndWorkDateIn(providerId, dates);
            if (!working) {
                repository.deleteAllInBatch(existing);
                return;
            }
            Set<LocalDate> present = existing.stream()
                    .map(WorkingDay::getWorkDate)
                    .collect(Collectors.toSet());
            repository.saveAll(dates.stream()
                    .distinct()
                    .filter(date -> !present.contains(date))
                    .map(date -> WorkingDay.builder()
                            .providerId(providerId)
                            .workDate(date)
                            .working(true)
                            .build())
                    .toList());
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to save working days of provider " + providerId, e);
        }
    }

    @Override
    @Transactional
    public void clearFrom(String providerId, LocalDate from, Set<LocalDate> keep) {
        try {
            repository.deleteAllInBatch(repository.findByProviderIdAndWorkDateGreaterThanEqual(providerId, from)
                    .stream()
                    .filter(day -> !keep.contains(day.getWorkDate()))
                    .toList());
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to clear working days of provider " + providerId, e);
        }
    }
}
