package org.example.course.service;

/**
 * Malformed request to the engine, such as an unknown unit or a missing required value.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
