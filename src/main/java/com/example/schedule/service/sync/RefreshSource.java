package com.example.schedule.service.sync;

public enum RefreshSource {
    /** Fixed-interval background poll. */
    POLL(true),
    /** External slot change pushed through the notification channel. */
    PUSH(true),
    /** An edit session was cancelled or expired. */
    SESSION_END(true),
    /** The observed provider or page changed. */
    NAVIGATION(false),
    /** A local mutation settled, successfully or not. */
    MUTATION(false);

    private final boolean background;

    RefreshSource(boolean background) {
        this.background = background;
    }

    /** Background refreshes are skipped while an edit session is open. */
    public boolean isBackground() {
        return background;
    }
}
