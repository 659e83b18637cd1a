package com.example.schedule.service.util;

import com.example.schedule.service.exception.ScheduleValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotGeneratorTest {

    @Test
    void shouldFitTwoHalfHourSlotsIntoOneHour() {
        assertThat(SlotGenerator.generate("09:00", "10:00", 30)).containsExactly("09:00", "09:30");
    }

    @Test
    void shouldReturnNothingWhenWindowIsShorterThanDuration() {
        assertThat(SlotGenerator.generate("09:00", "09:20", 30)).isEmpty();
    }

    @Test
    void shouldNotEmitSlotEndingAfterWindow() {
        List<LocalTime> starts = SlotGenerator.generate(LocalTime.of(9, 0), LocalTime.of(17, 0), 90);

        // 480 minutes / 90 = 5 full slots, the sixth would end at 18:00
        assertThat(starts).hasSize(5);
        assertThat(starts.get(starts.size() - 1)).isEqualTo(LocalTime.of(15, 0));
        assertThat(starts).allMatch(start -> !start.plusMinutes(90).isAfter(LocalTime.of(17, 0)));
    }

    @Test
    void shouldKeepMinutesOfOddStart() {
        assertThat(SlotGenerator.generate("9:05", "11:05", 60)).containsExactly("09:05", "10:05");
    }

    @Test
    void shouldRejectStartNotBeforeEnd() {
        assertThatThrownBy(() -> SlotGenerator.generate("10:00", "10:00", 30))
                .isInstanceOf(ScheduleValidationException.class)
                .hasMessage("Start time must be earlier than end time");
    }

    @Test
    void shouldRejectNonPositiveDuration() {
        assertThatThrownBy(() -> SlotGenerator.generate("09:00", "17:00", 0))
                .isInstanceOf(ScheduleValidationException.class)
                .hasMessage("Duration must be greater than 0");
    }
}
