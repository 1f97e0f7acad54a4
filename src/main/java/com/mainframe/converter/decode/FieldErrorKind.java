package com.mainframe.converter.decode;

/**
 * Reasons a single field could not be decoded. Each kind knows how to render
 * itself as the inline token written in place of the field value.
 */
public enum FieldErrorKind {

    /**
     * A digit nibble outside 0-9 in packed decimal data.
     */
    INVALID_PACKED_DECIMAL {
        @Override
        public String render(String detail, String hex) {
            return "ERROR(COMP3_INVALID):" + hex;
        }
    },

    /**
     * PV9 / PSV9 field declared without a decimal-place attribute.
     */
    MISSING_SCALE_ATTRIBUTE {
        @Override
        public String render(String detail, String hex) {
            return "ERROR(PV9/PSV9_NO_ATTR):" + hex;
        }
    },

    /**
     * Type token with no decode rule.
     */
    UNSUPPORTED_TYPE {
        @Override
        public String render(String detail, String hex) {
            return "UNSUPPORTED_TYPE(" + detail + "):" + hex;
        }
    },

    /**
     * The mapping table points a double-byte code at something that is not a Unicode code point.
     */
    INVALID_CODE_POINT {
        @Override
        public String render(String detail, String hex) {
            return "ERROR(INVALID_CODE_POINT):" + hex;
        }
    },

    /**
     * Unexpected failure inside a decoder.
     */
    CONVERSION_ERROR {
        @Override
        public String render(String detail, String hex) {
            return "CONVERSION_ERROR: " + detail;
        }
    };

    public abstract String render(String detail, String hex);
}
