package com.example.schedule.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * @param slotTimes            generated HH:MM start times for a full day
 * @param slotsPerDay          slots that would land on each date after past-time filtering
 * @param existingSlots        slots currently stored in the window
 * @param confirmationRequired true when running the setup would replace existing slots
 */
public record BatchSetupPreview(List<String> slotTimes,
                                Map<LocalDate, Integer> slotsPerDay,
                                int existingSlots,
                                boolean confirmationRequired) {

    public int totalSlots() {
        return slotsPerDay.values().stream().mapToInt(Integer::intValue).sum();
    }
}
