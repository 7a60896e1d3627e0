package com.finopti.remediation;

/**
 * The RCA document or resolution plan is missing or cannot be read.
 */
public class InvalidPlanException extends Exception {

    public InvalidPlanException(String message) {
        super(message);
    }

    public InvalidPlanException(String message, Throwable cause) {
        super(message, cause);
    }
}
