package com.example.schedule.service.sync;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.mockito.Mockito.verify;

class EditSessionSweeperTest {

    @Test
    void shouldAskSyncToReleaseExpiredSessions() {
        SyncController sync = Mockito.mock(SyncController.class);

        new EditSessionSweeper(sync).releaseExpired();

        verify(sync).releaseExpiredSessions();
    }
}
