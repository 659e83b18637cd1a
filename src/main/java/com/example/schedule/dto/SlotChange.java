package com.example.schedule.dto;

public record SlotChange(String providerId, Long slotId, ChangeType type) {

    public enum ChangeType { CREATED, UPDATED, DELETED, BOOKED, RELEASED }
}
