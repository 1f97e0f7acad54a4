package com.mainframe.converter.decode;

import lombok.RequiredArgsConstructor;

/**
 * Zoned decimal fields: one text byte per digit, decimal point implied by the picture.
 */
@RequiredArgsConstructor
public class ZonedDecimalDecoder {

    /**
     * Value returned for an empty {@code V9} field.
     */
    static final String EMPTY_LEADING_DECIMAL = "0.0";

    private final SingleByteTextDecoder textDecoder;

    /**
     * PIC 9: leading zeros removed, all-zero or blank input becomes "0".
     */
    public String decodeInteger(byte[] bytes) {
        String digits = DecodeUtil.stripLeadingZeros(textDecoder.decode(bytes));
        return digits.isEmpty() ? "0" : digits;
    }

    /**
     * PIC 9(m)V9(n): decimal point inserted {@code decimalDigits} places from the right.
     * A blank field stays blank.
     */
    public String decodeScaled(byte[] bytes, int decimalDigits) {
        String digits = textDecoder.decode(bytes);
        if (digits.isEmpty()) {
            return "";
        }
        return DecodeUtil.insertDecimalPoint(digits, Math.max(decimalDigits, 0));
    }

    /**
     * PIC V9...: every digit falls after the decimal point. Any declared digit
     * count is ignored.
     */
    public String decodeLeadingDecimal(byte[] bytes) {
        String digits = DecodeUtil.stripLeadingZeros(textDecoder.decode(bytes));
        if (digits.isEmpty()) {
            return EMPTY_LEADING_DECIMAL;
        }
        return "0." + digits;
    }
}
