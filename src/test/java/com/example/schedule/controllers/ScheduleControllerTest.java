package com.example.schedule.controllers;

import com.example.schedule.dto.BatchSetupResult;
import com.example.schedule.dto.DaySchedule;
import com.example.schedule.dto.QuickSetupRequest;
import com.example.schedule.dto.ScheduleView;
import com.example.schedule.dto.SlotView;
import com.example.schedule.service.ScheduleService;
import com.example.schedule.service.auth.ProviderSession;
import com.example.schedule.service.exception.SessionAuthException;
import com.example.schedule.service.exception.SlotConflictException;
import com.example.schedule.service.exception.SlotNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ScheduleController.class)
@AutoConfigureMockMvc(addFilters = false)
class ScheduleControllerTest {

    @SpringBootConfiguration
    @Import({ScheduleController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    private static final String TOKEN = "session-token";
    private static final ProviderSession SESSION = new ProviderSession("provider-1", null);
    private static final LocalDate DAY = LocalDate.of(2024, 6, 11);

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    ScheduleService scheduleService;

    @MockBean
    SessionVerifier sessionVerifier;

    @BeforeEach
    void setup() {
        Mockito.reset(scheduleService, sessionVerifier);
        when(sessionVerifier.verify(TOKEN)).thenReturn(SESSION);
    }

    @Test
    void page_returnsDaysOfRequestedPage() throws Exception {
        SlotView slot = new SlotView(3L, DAY, "09:00", "09:00:00", "10:00:00", false, true);
        ScheduleView view = new ScheduleView("provider-1", 1,
                List.of(new DaySchedule(DAY, DAY.getDayOfWeek(), true, List.of(slot))));
        when(scheduleService.openSchedule(SESSION, 1)).thenReturn(CompletableFuture.completedFuture(view));

        MvcResult result = mockMvc.perform(get("/schedule").param("page", "1").header("X-Session-Token", TOKEN))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pageIndex").value(1))
                .andExpect(jsonPath("$.days[0].date").value("2024-06-11"))
                .andExpect(jsonPath("$.days[0].workingDay").value(true))
                .andExpect(jsonPath("$.days[0].slots[0].time").value("09:00"));
    }

    @Test
    void page_returns401_whenNotLoggedIn() throws Exception {
        when(sessionVerifier.verify(null)).thenThrow(new SessionAuthException("Please login to manage your schedule"));

        mockMvc.perform(get("/schedule"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("AUTH"))
                .andExpect(jsonPath("$.message").value("Please login to manage your schedule"));
    }

    @Test
    void current_returnsViewWithLocalChanges() throws Exception {
        SlotView booked = new SlotView(4L, DAY, "12:00", "12:00:00", "13:00:00", true, false);
        ScheduleView view = new ScheduleView("provider-1", 0,
                List.of(new DaySchedule(DAY, DAY.getDayOfWeek(), true, List.of(booked))));
        when(scheduleService.currentSchedule(SESSION)).thenReturn(Optional.of(view));

        mockMvc.perform(get("/schedule/current").header("X-Session-Token", TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.days[0].slots.length()").value(1))
                .andExpect(jsonPath("$.days[0].slots[0].booked").value(true));
    }

    @Test
    void current_returns204_whenNotObserved() throws Exception {
        when(scheduleService.currentSchedule(SESSION)).thenReturn(Optional.empty());

        mockMvc.perform(get("/schedule/current").header("X-Session-Token", TOKEN))
                .andExpect(status().isNoContent());
    }

    @Test
    void observation_endsOnDelete() throws Exception {
        mockMvc.perform(delete("/schedule/observation").header("X-Session-Token", TOKEN))
                .andExpect(status().isNoContent());

        verify(scheduleService).closeSchedule(SESSION);
    }

    @Test
    void toggle_returnsNewWorkingFlag() throws Exception {
        when(scheduleService.toggleDayOff(SESSION, DAY)).thenReturn(false);

        mockMvc.perform(post("/schedule/days/2024-06-11/toggle").header("X-Session-Token", TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.workingDay").value(false));
    }

    @Test
    void toggle_returns409_whenDayHasBookings() throws Exception {
        when(scheduleService.toggleDayOff(SESSION, DAY))
                .thenThrow(new SlotConflictException("2024-06-11 has booked slots and cannot be turned off"));

        mockMvc.perform(post("/schedule/days/2024-06-11/toggle").header("X-Session-Token", TOKEN))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("CONFLICT"));
    }

    @Test
    void toggle_returns400_forMalformedDate() throws Exception {
        mockMvc.perform(post("/schedule/days/tomorrow/toggle").header("X-Session-Token", TOKEN))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"));
    }

    @Test
    void addSlot_returns201() throws Exception {
        SlotView created = new SlotView(4L, DAY, "10:30", "10:30:00", "11:30:00", false, true);
        when(scheduleService.addSlot(SESSION, DAY, "10:30")).thenReturn(created);

        mockMvc.perform(post("/schedule/days/2024-06-11/slots")
                        .header("X-Session-Token", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"time\":\"10:30\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(4))
                .andExpect(jsonPath("$.endTime").value("11:30:00"));
    }

    @Test
    void deleteSlot_returns404_whenMissing() throws Exception {
        doThrow(new SlotNotFoundException(9L)).when(scheduleService).deleteSlot(SESSION, 9L);

        mockMvc.perform(delete("/schedule/slots/9").header("X-Session-Token", TOKEN))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Slot 9 not found"));
    }

    @Test
    void quickSetup_returns409_untilConfirmed() throws Exception {
        when(scheduleService.quickSetup(eq(SESSION), any(QuickSetupRequest.class), eq(false)))
                .thenReturn(CompletableFuture.completedFuture(BatchSetupResult.confirmationRequired(12)));

        MvcResult result = mockMvc.perform(post("/schedule/quick-setup")
                        .header("X-Session-Token", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new QuickSetupRequest("09:00", "17:00", 60))))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("CONFIRMATION_REQUIRED"))
                .andExpect(jsonPath("$.existingSlots").value(12));
    }

    @Test
    void quickSetup_passesConfirmation() throws Exception {
        when(scheduleService.quickSetup(eq(SESSION), any(QuickSetupRequest.class), eq(true)))
                .thenReturn(CompletableFuture.completedFuture(
                        BatchSetupResult.applied(12, 12, 56, 0, List.of(DAY))));

        MvcResult result = mockMvc.perform(post("/schedule/quick-setup")
                        .param("confirmed", "true")
                        .header("X-Session-Token", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new QuickSetupRequest("09:00", "17:00", 60))))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inserted").value(56));
        verify(scheduleService).quickSetup(eq(SESSION), any(QuickSetupRequest.class), eq(true));
    }
}
