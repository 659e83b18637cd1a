package com.example.schedule.service.exception;

import lombok.Getter;

/**
 * Typed failure of a schedule operation. Callers only need the {@link ErrorKind}
 * to decide how to surface it.
 */
@Getter
public class ScheduleException extends RuntimeException {

    private final ErrorKind kind;

    public ScheduleException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScheduleException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
