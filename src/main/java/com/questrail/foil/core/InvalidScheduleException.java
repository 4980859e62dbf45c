package com.questrail.foil.core;

/**
 * Indicates that a schedule was configured with values no execution strategy
 * could honour, such as a zero or negative period. Raised before anything is
 * submitted.
 */
public final class InvalidScheduleException extends IllegalArgumentException
{
    public InvalidScheduleException(String message) {
        super(message);
    }
}
