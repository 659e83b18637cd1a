package com.example.schedule.service.exception;

public class ScheduleStorageException extends ScheduleException {

    public ScheduleStorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
