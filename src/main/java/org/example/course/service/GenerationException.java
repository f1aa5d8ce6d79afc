package org.example.course.service;

/**
 * A unit could not be generated. The unit is left requestable again.
 */
public class GenerationException extends RuntimeException {

    public enum Cause {
        UPSTREAM,
        PARSE,
        TIMEOUT
    }

    private final Cause failureCause;

    public GenerationException(Cause failureCause, String message) {
        super(message);
        this.failureCause = failureCause;
    }

    public GenerationException(Cause failureCause, String message, Throwable cause) {
        super(message, cause);
        this.failureCause = failureCause;
    }

    public Cause getFailureCause() {
        return failureCause;
    }
}
