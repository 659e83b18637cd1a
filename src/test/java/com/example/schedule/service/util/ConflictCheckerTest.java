package com.example.schedule.service.util;

import com.example.schedule.model.Slot;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;

import static com.example.schedule.support.ScheduleTestData.TODAY;
import static com.example.schedule.support.ScheduleTestData.slot;
import static org.assertj.core.api.Assertions.assertThat;

class ConflictCheckerTest {

    private Slot withId(Slot slot, long id) {
        slot.setId(id);
        return slot;
    }

    @Test
    void shouldIgnoreSecondsWhenComparing() {
        List<Slot> day = List.of(withId(slot(TODAY, "09:00:00"), 1L));

        assertThat(ConflictChecker.isDuplicate(day, "09:00", null)).isTrue();
        assertThat(ConflictChecker.isDuplicate(day, LocalTime.of(9, 0, 42), null)).isTrue();
    }

    @Test
    void shouldExcludeSlotBeingEdited() {
        List<Slot> day = List.of(withId(slot(TODAY, "09:00"), 1L), withId(slot(TODAY, "10:00"), 2L));

        assertThat(ConflictChecker.isDuplicate(day, "09:00", 1L)).isFalse();
        assertThat(ConflictChecker.isDuplicate(day, "10:00", 1L)).isTrue();
    }

    @Test
    void shouldAllowFreeTime() {
        List<Slot> day = List.of(withId(slot(TODAY, "09:00"), 1L));

        assertThat(ConflictChecker.isDuplicate(day, "09:30", null)).isFalse();
        assertThat(ConflictChecker.isDuplicate(List.of(), "09:00", null)).isFalse();
    }
}
