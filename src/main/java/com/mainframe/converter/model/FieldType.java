package com.mainframe.converter.model;

import java.util.List;

/**
 * Decode variants a field type token can resolve to.
 * Resolved once per field when the schema is loaded.
 */
public enum FieldType {
    /**
     * Single-byte legacy text ({@code X}).
     */
    ALPHANUMERIC,

    /**
     * Unsigned zoned integer ({@code 9}).
     */
    ZONED_INTEGER,

    /**
     * Double-byte text translated through the code mapping table ({@code N}).
     */
    DOUBLE_BYTE,

    /**
     * Zoned decimal with implied scale ({@code 9(5)V9(2)}).
     */
    ZONED_SCALED,

    /**
     * Zoned decimal with a leading implied decimal point ({@code V9...}).
     */
    ZONED_LEADING_DECIMAL,

    /**
     * Packed decimal, COMP-3 ({@code P9}, {@code PS9}, {@code S9}, {@code SP9}, {@code PV9}, {@code PSV9}).
     */
    PACKED_DECIMAL,

    /**
     * Anything else. Decoding always yields an error token.
     */
    UNSUPPORTED;

    private static final List<String> PACKED_PREFIXES = List.of("P9", "PS9", "S9", "SP9");

    public static FieldType fromTypeToken(String typeToken) {
        if (typeToken == null) {
            return UNSUPPORTED;
        }
        String normalized = typeToken.trim().toUpperCase();
        switch (normalized) {
            case "X":
                return ALPHANUMERIC;
            case "9":
                return ZONED_INTEGER;
            case "N":
                return DOUBLE_BYTE;
            default:
                break;
        }
        if (normalized.startsWith("9") && normalized.contains("V9")) {
            return ZONED_SCALED;
        }
        if (normalized.startsWith("V9")) {
            return ZONED_LEADING_DECIMAL;
        }
        if (PACKED_PREFIXES.stream().anyMatch(normalized::startsWith) || isPackedScaleOnly(normalized)) {
            return PACKED_DECIMAL;
        }
        return UNSUPPORTED;
    }

    /**
     * {@code PV9} and {@code PSV9} carry no digit counts; their scale comes
     * from the field's numeric attribute.
     */
    public static boolean isPackedScaleOnly(String typeToken) {
        return "PV9".equals(typeToken) || "PSV9".equals(typeToken);
    }
}
