package com.mainframe.converter.model;

import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Digit counts extracted from a PIC-style type token such as {@code 9(5)V9(2)}
 * or {@code PS9(7)}.
 *
 * Tokens that are not numeric pictures (for example {@code X} or {@code N})
 * parse to zero integer and zero decimal digits. Callers decide what that means
 * for their field type.
 */
@Value
public class PictureClause {

    public static final PictureClause NONE = new PictureClause(0, 0);

    // Sign/packed/scale markers, the integer digit marker with optional repeat count,
    // then an optional V9 with its own repeat count.
    private static final Pattern PICTURE_PATTERN = Pattern.compile(
            "^[PSV]*9(?:\\((\\d+)\\))?(?:V9(?:\\((\\d+)\\))?)?$"
    );

    int integerDigits;
    int decimalDigits;

    /**
     * Parse a type token. Never throws and never returns null.
     */
    public static PictureClause parse(String typeToken) {
        if (typeToken == null || typeToken.isBlank()) {
            return NONE;
        }

        Matcher matcher = PICTURE_PATTERN.matcher(typeToken);
        if (!matcher.matches()) {
            return NONE;
        }

        int intDigits = parseRepeatCount(matcher.group(1));
        int decDigits = typeToken.indexOf('V') >= 0 ? parseRepeatCount(matcher.group(2)) : 0;

        if (intDigits == 0 && decDigits == 0) {
            return NONE;
        }
        return new PictureClause(intDigits, decDigits);
    }

    private static int parseRepeatCount(String count) {
        if (count == null) {
            return 0;
        }
        try {
            return Integer.parseInt(count);
        } catch (NumberFormatException e) {
            // Repeat counts beyond int range cannot describe a real field
            return 0;
        }
    }

    public boolean hasDecimalDigits() {
        return decimalDigits > 0;
    }
}
