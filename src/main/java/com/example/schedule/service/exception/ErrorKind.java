package com.example.schedule.service.exception;

public enum ErrorKind {
    VALIDATION,
    AUTH,
    NOT_FOUND,
    CONFLICT,
    STORAGE
}
