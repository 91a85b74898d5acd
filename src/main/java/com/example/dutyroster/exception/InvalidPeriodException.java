package com.example.dutyroster.exception;

import java.time.LocalDate;

/**
 * Raised before any slot is generated when the rotation bounds are malformed.
 */
public class InvalidPeriodException extends ScheduleGenerationException {

    public InvalidPeriodException(String message, LocalDate start, LocalDate end) {
        super("INVALID_PERIOD", message, start, end);
    }
}
