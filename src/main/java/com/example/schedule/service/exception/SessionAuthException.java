package com.example.schedule.service.exception;

public class SessionAuthException extends ScheduleException {

    public SessionAuthException(String message) {
        super(ErrorKind.AUTH, message);
    }
}
