package com.example.schedule.service.impl;

import com.example.schedule.config.ScheduleConfig;
import com.example.schedule.model.Slot;
import com.example.schedule.service.CalendarWindowing;
import com.example.schedule.service.SingleSlotEditor;
import com.example.schedule.service.WorkingDayService;
import com.example.schedule.service.exception.ScheduleValidationException;
import com.example.schedule.service.exception.SlotConflictException;
import com.example.schedule.service.exception.SlotNotFoundException;
import com.example.schedule.service.util.ConflictChecker;
import com.example.schedule.service.util.TimeFormat;
import com.example.schedule.store.SlotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SingleSlotEditorImpl implements SingleSlotEditor {

    private final SlotStore slotStore;
    private final WorkingDayService workingDays;
    private final CalendarWindowing calendar;
    private final ScheduleConfig config;

    @Override
    public Slot addSlot(String providerId, LocalDate date, LocalTime time) {
        requireBookableDate(date);
        if (time != null && calendar.isPastDue(date, time)) {
            throw new ScheduleValidationException("Cannot add slots for times that have already passed");
        }
        if (!workingDays.isWorkingDay(providerId, date)) {
            throw new ScheduleValidationException(date + " is not a working day");
        }

        List<Slot> daySlots = slotStore.listByDateRange(providerId, date, date);
        LocalTime start = resolveStart(daySlots, time);

        if (calendar.isPastDue(date, start)) {
            throw new ScheduleValidationException("Cannot add slots for times that have already passed");
        }
        if (ConflictChecker.isDuplicate(daySlots, start, null)) {
            throw new ScheduleValidationException("This time slot already exists");
        }

        Slot created = slotStore.create(Slot.builder()
                .providerId(providerId)
                .date(date)
                .startTime(start)
                .endTime(start.plusMinutes(config.getSingleSlotMinutes()))
                .booked(false)
                .build());

        log.info("Provider {}: slot {} added on {} at {}", providerId, created.getId(), date, TimeFormat.format(start));
        return created;
    }

    @Override
    public Slot requireEditable(String providerId, Long slotId) {
        Slot slot = slotStore.find(slotId)
                .filter(s -> providerId.equals(s.getProviderId()))
                .orElseThrow(() -> new SlotNotFoundException(slotId));
        if (slot.isBooked()) {
            throw new SlotConflictException("Booked slots cannot be changed");
        }
        return slot;
    }

    @Override
    public Slot editSlot(String providerId, Long slotId, LocalTime newTime) {
        LocalTime start = TimeFormat.normalize(newTime);
        Slot slot = requireEditable(providerId, slotId);

        if (calendar.isPastDue(slot.getDate(), start)) {
            throw new ScheduleValidationException("Cannot move a slot to a time that has already passed");
        }
        List<Slot> daySlots = slotStore.listByDateRange(providerId, slot.getDate(), slot.getDate());
        if (ConflictChecker.isDuplicate(daySlots, start, slotId)) {
            throw new ScheduleValidationException("This time slot already exists");
        }

        Slot updated = slotStore.update(slotId, start, start.plusMinutes(config.getSingleSlotMinutes()));
        log.info("Provider {}: slot {} moved from {} to {}", providerId, slotId,
                TimeFormat.format(slot.getStartTime()), TimeFormat.format(start));
        return updated;
    }

    @Override
    public void deleteSlot(String providerId, Long slotId) {
        requireEditable(providerId, slotId);
        slotStore.delete(slotId);
        log.info("Provider {}: slot {} deleted", providerId, slotId);
    }

    @Override
    public boolean toggleDayOff(String providerId, LocalDate date) {
        requireBookableDate(date);

        if (!workingDays.isWorkingDay(providerId, date)) {
            workingDays.setWorkingDay(providerId, date, true);
            return true;
        }

        List<Slot> daySlots = slotStore.listByDateRange(providerId, date, date);
        if (daySlots.stream().anyMatch(Slot::isBooked)) {
            throw new SlotConflictException(date + " has booked slots and cannot be turned off");
        }

        int removed = slotStore.deleteRange(providerId, date, date);
        // a booking may have landed between the read and the delete
        if (!slotStore.listByDateRange(providerId, date, date).isEmpty()) {
            throw new SlotConflictException(date + " got booked while being turned off");
        }
        workingDays.setWorkingDay(providerId, date, false);
        log.info("Provider {}: {} turned off, {} slots removed", providerId, date, removed);
        return false;
    }

    private void requireBookableDate(LocalDate date) {
        if (date == null) {
            throw new ScheduleValidationException("Date is required");
        }
        if (calendar.isPast(date)) {
            throw new ScheduleValidationException("Cannot change days in the past");
        }
        if (calendar.isBeyondHorizon(date)) {
            throw new ScheduleValidationException(date + " is beyond the schedule horizon");
        }
    }

    private LocalTime resolveStart(List<Slot> daySlots, LocalTime requested) {
        if (requested != null) {
            return TimeFormat.normalize(requested);
        }
        LocalTime latest = daySlots.stream()
                .map(Slot::getStartTime)
                .max(Comparator.naturalOrder())
                .orElseThrow(() -> new ScheduleValidationException("Please select a start time for the first slot"));

        LocalTime next = latest.plusMinutes(config.getNextSlotStepMinutes());
        if (!next.isAfter(latest)) {
            throw new ScheduleValidationException("No room left after the last slot of the day");
        }
        return TimeFormat.normalize(next);
    }
}
