package com.example.schedule.service.impl;

import com.example.schedule.config.ScheduleConfig;
import com.example.schedule.dto.BatchSetupPreview;
import com.example.schedule.dto.BatchSetupResult;
import com.example.schedule.dto.ClearResult;
import com.example.schedule.dto.QuickSetupRequest;
import com.example.schedule.model.Slot;
import com.example.schedule.service.BatchSetupCoordinator;
import com.example.schedule.service.CalendarWindowing;
import com.example.schedule.service.WorkingDayService;
import com.example.schedule.service.exception.ScheduleException;
import com.example.schedule.service.exception.ScheduleValidationException;
import com.example.schedule.service.util.SlotGenerator;
import com.example.schedule.service.util.TimeFormat;
import com.example.schedule.store.SlotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Slf4j
@Service
@RequiredArgsConstructor
public class BatchSetupCoordinatorImpl implements BatchSetupCoordinator {

    private final SlotStore slotStore;
    private final WorkingDayService workingDays;
    private final CalendarWindowing calendar;
    private final ScheduleConfig config;

    @Override
    public BatchSetupPreview preview(String providerId, QuickSetupRequest request) {
        List<LocalTime> starts = generate(request);
        List<LocalDate> window = window();

        Map<LocalDate, Integer> perDay = new LinkedHashMap<>();
        buildCandidates(providerId, window, starts, request.getDurationMinutes())
                .forEach(slot -> perDay.merge(slot.getDate(), 1, Integer::sum));
        window.forEach(date -> perDay.putIfAbsent(date, 0));

        int existing = slotStore.listByDateRange(providerId, window.get(0), window.get(window.size() - 1)).size();
        return new BatchSetupPreview(
                starts.stream().map(TimeFormat::formatShort).toList(),
                perDay,
                existing,
                existing > 0
        );
    }

    @Override
    public BatchSetupResult execute(String providerId, QuickSetupRequest request, boolean confirmed) {
        List<LocalTime> starts = generate(request);
        List<LocalDate> window = window();
        LocalDate from = window.get(0);
        LocalDate to = window.get(window.size() - 1);

        int existing = slotStore.listByDateRange(providerId, from, to).size();
        if (existing > 0 && !confirmed) {
            log.info("Quick setup for provider {} needs confirmation: {} slots exist in {}..{}",
                    providerId, existing, from, to);
            return BatchSetupResult.confirmationRequired(existing);
        }

        List<Slot> candidates = buildCandidates(providerId, window, starts, request.getDurationMinutes());
        log.info("Quick setup for provider {}: {} slots/day from {} to {} every {} min, {} slots in total",
                providerId, starts.size(), request.getFromTime(), request.getToTime(),
                request.getDurationMinutes(), candidates.size());

        SlotStore.ReplaceResult replaced = new SlotStore.ReplaceResult(0, 0, 0);
        try {
            if (!candidates.isEmpty()) {
                replaced = slotStore.replaceRange(providerId, from, to, candidates);
            }
            workingDays.setWorkingDays(providerId, window, true);
        } catch (ScheduleException e) {
            log.error("Quick setup failed for provider {}: {}", providerId, e.getMessage());
            throw e;
        }

        return BatchSetupResult.applied(existing, replaced.deleted(), replaced.inserted(), replaced.skipped(), window);
    }

    @Override
    public ClearResult clear(String providerId) {
        LocalDate today = calendar.today();
        int deleted = slotStore.deleteFrom(providerId, today);

        // booked slots survive the clear, their days stay working
        Set<LocalDate> keep = slotStore.listByDateRange(providerId, today, calendar.horizonEnd()).stream()
                .map(Slot::getDate)
                .collect(Collectors.toSet());
        workingDays.clearFrom(providerId, today, keep);

        log.info("Provider {}: cleared {} slots from {}", providerId, deleted, today);
        return new ClearResult(today, deleted, keep);
    }

    private List<LocalTime> generate(QuickSetupRequest request) {
        if (request == null) {
            throw new ScheduleValidationException("Quick setup parameters are required");
        }
        return SlotGenerator.generate(
                TimeFormat.parse(request.getFromTime()),
                TimeFormat.parse(request.getToTime()),
                request.getDurationMinutes());
    }

    private List<LocalDate> window() {
        LocalDate today = calendar.today();
        return IntStream.range(0, config.getSetupDays())
                .mapToObj(today::plusDays)
                .toList();
    }

    /** Today's starts at or before the current minute are dropped; later days keep all. */
    private List<Slot> buildCandidates(String providerId, List<LocalDate> window, List<LocalTime> starts, int durationMinutes) {
        List<Slot> slots = new ArrayList<>();
        for (LocalDate date : window) {
            for (LocalTime start : starts) {
                if (calendar.isPastDue(date, start)) {
                    continue;
                }
                slots.add(Slot.builder()
                        .providerId(providerId)
                        .date(date)
                        .startTime(TimeFormat.normalize(start))
                        .endTime(TimeFormat.normalize(start.plusMinutes(durationMinutes)))
                        .booked(false)
                        .build());
            }
        }
        return slots;
    }
}
