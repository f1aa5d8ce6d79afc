package org.example.course.service;

/**
 * Generator output that is not the expected JSON shape. Keeps the raw text for diagnostics.
 */
public class MalformedResponseException extends RuntimeException {

    private final String rawText;

    public MalformedResponseException(String message, String rawText) {
        super(message);
        this.rawText = rawText;
    }

    public MalformedResponseException(String message, String rawText, Throwable cause) {
        super(message, cause);
        this.rawText = rawText;
    }

    public String getRawText() {
        return rawText;
    }
}
