package com.mainframe.converter.decode;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.charset.Charset;

/**
 * Codec settings handed to the field decoders at construction time.
 *
 * Defaults match the usual source environment: international EBCDIC (cp500)
 * for single-byte text, and the JEF double-byte conventions where the pair
 * 0x42 0x42 stands for a full-width blank.
 */
@Value
@Builder(toBuilder = true)
public class DecoderSettings {

    public static final String DEFAULT_SINGLE_BYTE_ENCODING = "cp500";

    /**
     * Single-byte legacy charset used for X, 9 and zoned decimal fields.
     */
    @NonNull
    @Builder.Default
    Charset singleByteCharset = Charset.forName(DEFAULT_SINGLE_BYTE_ENCODING);

    /**
     * Emitted for double-byte codes that cannot be translated.
     */
    @NonNull
    @Builder.Default
    String undefinedCharacter = "★";

    /**
     * Two-byte sequence rewritten to the double-byte space pair before table lookup.
     */
    @Builder.Default
    byte doubleByteMarkerHigh = 0x42;

    @Builder.Default
    byte doubleByteMarkerLow = 0x42;

    /**
     * Full-width space as encoded by EUC-JP (U+3000 is 0xA1 0xA1).
     */
    @Builder.Default
    byte doubleByteSpaceHigh = (byte) 0xA1;

    @Builder.Default
    byte doubleByteSpaceLow = (byte) 0xA1;

    public static DecoderSettings defaults() {
        return DecoderSettings.builder().build();
    }

    public static DecoderSettings forEncoding(String encoding) {
        return DecoderSettings.builder().singleByteCharset(Charset.forName(encoding)).build();
    }
}
