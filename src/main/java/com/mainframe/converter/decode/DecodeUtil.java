package com.mainframe.converter.decode;

import lombok.experimental.UtilityClass;

import java.util.HexFormat;

@UtilityClass
public class DecodeUtil {

    private static final HexFormat HEX = HexFormat.of();

    // EBCDIC NL (0x15) decodes to U+0085, which Character.isWhitespace does not cover
    private static final char NEXT_LINE = '\u0085';

    /**
     * Lower-case hex, no separators.
     */
    public static String toHex(byte[] bytes) {
        return bytes == null ? "" : HEX.formatHex(bytes);
    }

    /**
     * Trim leading and trailing whitespace, including no-break spaces, full-width spaces and NEL.
     */
    public static String trimWhitespace(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && isBlankChar(s.charAt(start))) {
            start++;
        }
        while (end > start && isBlankChar(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(start, end);
    }

    public static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    /**
     * Place a decimal point {@code scale} digits from the right, padding with
     * zeros when there are not enough digits: ("123", 5) gives "0.00123".
     */
    public static String insertDecimalPoint(String digits, int scale) {
        if (scale <= 0) {
            return digits;
        }
        int total = digits.length();
        if (total <= scale) {
            return "0." + "0".repeat(scale - total) + digits;
        }
        int insertAt = total - scale;
        return digits.substring(0, insertAt) + '.' + digits.substring(insertAt);
    }

    private static boolean isBlankChar(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == NEXT_LINE;
    }
}
