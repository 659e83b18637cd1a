package com.example.schedule.service.exception;

public class SlotNotFoundException extends ScheduleException {

    public SlotNotFoundException(Long slotId) {
        super(ErrorKind.NOT_FOUND, "Slot " + slotId + " not found");
    }
}
