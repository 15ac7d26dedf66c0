package me.golemcore.agentloop.domain.parser;

/**
 * Raised when model output cannot be repaired into the expected shape or
 * violates a required constraint. {@link #getField()} names the offending
 * field ({@code "response"} when the text is not a JSON object at all).
 */
public class ResponseValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public ResponseValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public ResponseValidationException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
