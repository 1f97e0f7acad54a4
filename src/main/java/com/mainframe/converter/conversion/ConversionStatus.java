package com.mainframe.converter.conversion;

/**
 * Per-file outcome of a conversion.
 */
public enum ConversionStatus {
    SUCCESS("SUCCESS"),
    BINARY_NOT_FOUND("ERROR (BIN_NOT_FOUND)"),
    SCHEMA_NOT_FOUND("ERROR (CPY_NOT_FOUND)"),
    SCHEMA_PARSE_ERROR("ERROR (CPY_PARSE_ERROR)"),

    /**
     * I/O failure, or the file finished with field or record errors.
     */
    PROCESSING_ERROR("ERROR (PROCESSING_ERROR)");

    private final String label;

    ConversionStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
