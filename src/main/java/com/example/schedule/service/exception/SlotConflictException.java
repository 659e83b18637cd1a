package com.example.schedule.service.exception;

/** The slot (or a slot of the day) is booked and cannot be changed here. */
public class SlotConflictException extends ScheduleException {

    public SlotConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
