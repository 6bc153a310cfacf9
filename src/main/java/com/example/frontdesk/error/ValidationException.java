package com.example.frontdesk.error;

public class ValidationException extends FrontdeskException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() {
        return field;
    }

    @Override
    public String code() {
        return "validation_failed";
    }

    /** Throws when {@code value} is null or blank; returns it trimmed otherwise. */
    public static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
        return value.trim();
    }
}
