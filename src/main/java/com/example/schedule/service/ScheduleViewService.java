package com.example.schedule.service;

import com.example.schedule.dto.DaySchedule;
import com.example.schedule.dto.ScheduleView;
import com.example.schedule.dto.SlotView;
import com.example.schedule.model.Slot;
import com.example.schedule.store.SlotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Authoritative read of one calendar page.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleViewService {

    private final SlotStore slotStore;
    private final WorkingDayService workingDays;
    private final CalendarWindowing calendar;

    public ScheduleView loadPage(String providerId, int pageIndex) {
        List<LocalDate> dates = calendar.pageDates(pageIndex);
        LocalDate from = dates.get(0);
        LocalDate to = dates.get(dates.size() - 1);

        List<Slot> slots = slotStore.listByDateRange(providerId, from, to);
        Map<LocalDate, Boolean> working = workingDays.workingDays(providerId);

        Map<LocalDate, List<Slot>> byDate = slots.stream()
                .collect(Collectors.groupingBy(Slot::getDate));

        List<DaySchedule> days = dates.stream()
                .map(date -> new DaySchedule(
                        date,
                        date.getDayOfWeek(),
                        Boolean.TRUE.equals(working.get(date)),
                        byDate.getOrDefault(date, List.of()).stream()
                                .sorted(Comparator.comparing(Slot::getStartTime))
                                .map(SlotView::from)
                                .toList()))
                .toList();

        log.debug("Loaded page {} of provider {}: {} slots in {}..{}", pageIndex, providerId, slots.size(), from, to);
        return new ScheduleView(providerId, pageIndex, days);
    }
}
