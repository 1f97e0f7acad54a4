package com.mainframe.converter.mapping;

/**
 * The code mapping file could not be read. Fatal for the whole run.
 */
public class MappingLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MappingLoadException(String message) {
        super(message);
    }

    public MappingLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
