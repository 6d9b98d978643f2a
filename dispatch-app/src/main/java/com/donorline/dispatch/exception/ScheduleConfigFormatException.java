package com.donorline.dispatch.exception;

/**
 * A stored schedule configuration could not be read back.
 */
public class ScheduleConfigFormatException extends RuntimeException {

    public ScheduleConfigFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
