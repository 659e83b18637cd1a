package com.example.schedule.service.exception;

public class ScheduleValidationException extends ScheduleException {

    public ScheduleValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
