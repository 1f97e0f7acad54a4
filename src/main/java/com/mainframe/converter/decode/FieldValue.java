package com.mainframe.converter.decode;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of decoding one field: either the decoded text or an error.
 * Errors only become text when the record is written out.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldValue {
    String text;
    FieldErrorKind errorKind;
    String errorDetail;
    String rawHex;

    public static FieldValue ok(String text) {
        return new FieldValue(text, null, null, null);
    }

    public static FieldValue error(FieldErrorKind kind, String detail, byte[] rawBytes) {
        return new FieldValue(null, kind, detail, DecodeUtil.toHex(rawBytes));
    }

    public boolean isError() {
        return errorKind != null;
    }

    /**
     * Text written to the output: the value itself, or the inline error token.
     */
    public String toOutputText() {
        return isError() ? errorKind.render(errorDetail, rawHex) : text;
    }
}
