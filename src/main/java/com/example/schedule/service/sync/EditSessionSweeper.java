package com.example.schedule.service.sync;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EditSessionSweeper {

    private final SyncController sync;

    @Scheduled(fixedDelayString = "${schedule.edit-session-sweep-ms:10000}")
    public void releaseExpired() {
        sync.releaseExpiredSessions();
    }
}
