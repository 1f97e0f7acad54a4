package com.mainframe.converter.parser;

import lombok.Getter;

/**
 * Raised when a record layout cannot be used at all. Fatal for the file that
 * depends on the layout, never for the whole run.
 */
@Getter
public class SchemaParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        INVALID_RECORD_LENGTH,
        FIELD_EXCEEDS_RECORD,
        NO_FIELDS
    }

    private final Reason reason;

    public SchemaParseException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
