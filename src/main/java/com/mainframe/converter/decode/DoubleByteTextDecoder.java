package com.mainframe.converter.decode;

import com.mainframe.converter.mapping.CodeMappingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Double-byte (JEF style) text, translated pair by pair through the code mapping table.
 *
 * Codes missing from the table become the undefined-character placeholder, one
 * placeholder per byte pair. A dangling last byte also becomes one placeholder.
 */
public class DoubleByteTextDecoder {
    private static final Logger log = LoggerFactory.getLogger(DoubleByteTextDecoder.class);

    private final CodeMappingTable mappingTable;
    private final DecoderSettings settings;

    public DoubleByteTextDecoder(CodeMappingTable mappingTable, DecoderSettings settings) {
        this.mappingTable = mappingTable;
        this.settings = settings;
    }

    /**
     * @throws InvalidCodePointException when the table maps a code to a value that is not a Unicode code point
     */
    public String decode(byte[] bytes) {
        byte[] data = replaceBlankMarkers(bytes);
        String undefined = settings.getUndefinedCharacter();
        StringBuilder text = new StringBuilder(data.length);

        int i = 0;
        while (i < data.length) {
            if (i + 1 >= data.length) {
                log.warn("Incomplete byte sequence at end of double-byte data: {}. Using undefined character.",
                        String.format("%02x", data[i] & 0xFF));
                text.append(undefined);
                i++;
                continue;
            }

            String sourceHex = String.format(Locale.ROOT, "%02X%02X", data[i] & 0xFF, data[i + 1] & 0xFF);
            Optional<String> target = mappingTable.lookup(sourceHex);
            if (target.isEmpty()) {
                text.append(undefined);
            } else if (target.get().isEmpty()) {
                log.warn("Empty target hex in code mapping for source '{}'. Using undefined character.", sourceHex);
                text.append(undefined);
            } else {
                text.appendCodePoint(toCodePoint(sourceHex, target.get()));
            }
            i += 2;
        }

        return DecodeUtil.trimWhitespace(text.toString());
    }

    /**
     * Rewrite each occurrence of the blank marker pair to the full-width space
     * pair, scanning left to right without overlaps.
     */
    private byte[] replaceBlankMarkers(byte[] bytes) {
        byte[] data = bytes.clone();
        byte markerHigh = settings.getDoubleByteMarkerHigh();
        byte markerLow = settings.getDoubleByteMarkerLow();

        int i = 0;
        while (i + 1 < data.length) {
            if (data[i] == markerHigh && data[i + 1] == markerLow) {
                data[i] = settings.getDoubleByteSpaceHigh();
                data[i + 1] = settings.getDoubleByteSpaceLow();
                i += 2;
            } else {
                i++;
            }
        }
        return data;
    }

    private static int toCodePoint(String sourceHex, String targetHex) {
        int codePoint;
        try {
            codePoint = Integer.parseInt(targetHex, 16);
        } catch (NumberFormatException e) {
            throw new InvalidCodePointException(sourceHex, targetHex);
        }
        if (!Character.isValidCodePoint(codePoint)) {
            throw new InvalidCodePointException(sourceHex, targetHex);
        }
        return codePoint;
    }

    /**
     * A mapping table entry whose target is not a Unicode code point.
     */
    public static class InvalidCodePointException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public InvalidCodePointException(String sourceHex, String targetHex) {
            super("Invalid target hex '" + targetHex + "' in code mapping for source '" + sourceHex + "'");
        }
    }
}
