package com.example.schedule.controllers;

import com.example.schedule.dto.BatchSetupPreview;
import com.example.schedule.dto.BatchSetupResult;
import com.example.schedule.dto.ClearResult;
import com.example.schedule.dto.QuickSetupRequest;
import com.example.schedule.dto.ScheduleView;
import com.example.schedule.dto.SlotTimeRequest;
import com.example.schedule.dto.SlotView;
import com.example.schedule.service.ScheduleService;
import com.example.schedule.service.auth.ProviderSession;
import com.example.schedule.service.sync.EditSession;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/schedule")
@RequiredArgsConstructor
public class ScheduleController {

    private static final String SESSION_HEADER = "X-Session-Token";

    private final ScheduleService scheduleService;
    private final SessionVerifier sessionVerifier;

    @GetMapping
    public CompletableFuture<ScheduleView> page(@RequestHeader(value = SESSION_HEADER, required = false) String token,
                                                @RequestParam(defaultValue = "0") int page) {
        return scheduleService.openSchedule(session(token), page);
    }

    /** The page as currently shown, with optimistic changes not yet confirmed by storage; 204 when not observed. */
    @GetMapping("/current")
    public ResponseEntity<ScheduleView> current(@RequestHeader(value = SESSION_HEADER, required = false) String token) {
        return scheduleService.currentSchedule(session(token))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @DeleteMapping("/observation")
    public ResponseEntity<Void> close(@RequestHeader(value = SESSION_HEADER, required = false) String token) {
        scheduleService.closeSchedule(session(token));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/days/{date}/toggle")
    public Map<String, Object> toggleDay(@RequestHeader(value = SESSION_HEADER, required = false) String token,
                                         @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        boolean working = scheduleService.toggleDayOff(session(token), date);
        return Map.of("date", date, "workingDay", working);
    }

    @PostMapping("/days/{date}/slots")
    public ResponseEntity<SlotView> addSlot(@RequestHeader(value = SESSION_HEADER, required = false) String token,
                                            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                            @RequestBody(required = false) SlotTimeRequest request) {
        String time = request != null ? request.getTime() : null;
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(scheduleService.addSlot(session(token), date, time));
    }

    @PostMapping("/slots/{slotId}/edit-session")
    public EditSession startEdit(@RequestHeader(value = SESSION_HEADER, required = false) String token,
                                 @PathVariable Long slotId) {
        return scheduleService.startEdit(session(token), slotId);
    }

    @PutMapping("/edit-sessions/{editToken}")
    public SlotView saveEdit(@RequestHeader(value = SESSION_HEADER, required = false) String token,
                             @PathVariable String editToken,
                             @RequestBody SlotTimeRequest request) {
        return scheduleService.saveEdit(session(token), editToken, request.getTime());
    }

    @DeleteMapping("/edit-sessions/{editToken}")
    public ResponseEntity<Void> cancelEdit(@RequestHeader(value = SESSION_HEADER, required = false) String token,
                                           @PathVariable String editToken) {
        scheduleService.cancelEdit(session(token), editToken);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/slots/{slotId}")
    public ResponseEntity<Void> deleteSlot(@RequestHeader(value = SESSION_HEADER, required = false) String token,
                                           @PathVariable Long slotId) {
        scheduleService.deleteSlot(session(token), slotId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/quick-setup/preview")
    public CompletableFuture<BatchSetupPreview> previewQuickSetup(
            @RequestHeader(value = SESSION_HEADER, required = false) String token,
            @RequestBody QuickSetupRequest request) {
        return scheduleService.previewQuickSetup(session(token), request);
    }

    /** 409 with the existing slot count when the window holds slots and the call is not confirmed. */
    @PostMapping("/quick-setup")
    public CompletableFuture<ResponseEntity<BatchSetupResult>> quickSetup(
            @RequestHeader(value = SESSION_HEADER, required = false) String token,
            @RequestParam(defaultValue = "false") boolean confirmed,
            @RequestBody QuickSetupRequest request) {
        return scheduleService.quickSetup(session(token), request, confirmed)
                .thenApply(result -> result.status() == BatchSetupResult.Status.CONFIRMATION_REQUIRED
                        ? ResponseEntity.status(HttpStatus.CONFLICT).body(result)
                        : ResponseEntity.ok(result));
    }

    @DeleteMapping("/quick-setup")
    public CompletableFuture<ClearResult> clearQuickSetup(
            @RequestHeader(value = SESSION_HEADER, required = false) String token) {
        return scheduleService.clearQuickSetup(session(token));
    }

    @GetMapping("/visibility")
    public Map<String, Boolean> visibility(@RequestHeader(value = SESSION_HEADER, required = false) String token) {
        return Map.of("visible", scheduleService.isVisible(session(token)));
    }

    @PutMapping("/visibility")
    public Map<String, Boolean> setVisibility(@RequestHeader(value = SESSION_HEADER, required = false) String token,
                                              @RequestBody Map<String, Boolean> body) {
        boolean visible = Boolean.TRUE.equals(body.get("visible"));
        return Map.of("visible", scheduleService.setVisible(session(token), visible));
    }

    private ProviderSession session(String token) {
        return sessionVerifier.verify(token);
    }
}
