package com.mainframe.converter.decode;

import com.mainframe.converter.decode.DoubleByteTextDecoder.InvalidCodePointException;
import com.mainframe.converter.mapping.CodeMappingTable;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DoubleByteTextDecoder.
 */
class DoubleByteTextDecoderTest {

    private static final String HIRAGANA_A = "あ";
    private static final String HIRAGANA_I = "い";
    private static final String FULL_WIDTH_SPACE = "　";
    private static final String UNDEFINED = "★";

    private final CodeMappingTable table = CodeMappingTable.of(Map.of(
            "A4A2", "3042",
            "A4A4", "3044",
            "A1A1", "3000",
            "B0A1", "",
            "B0A2", "110000"
    ));

    private final DoubleByteTextDecoder decoder = new DoubleByteTextDecoder(table, DecoderSettings.defaults());

    @Test
    void testDecodeMappedPairs() {
        assertThat(decoder.decode(bytes(0xA4, 0xA2, 0xA4, 0xA4))).isEqualTo(HIRAGANA_A + HIRAGANA_I);
    }

    @Test
    void testUnmappedPairsBecomeOnePlaceholderEach() {
        assertThat(decoder.decode(bytes(0x11, 0x22))).isEqualTo(UNDEFINED);
        assertThat(decoder.decode(bytes(0x11, 0x22, 0x33, 0x44))).isEqualTo(UNDEFINED + UNDEFINED);
        assertThat(decoder.decode(bytes(0xA4, 0xA2, 0x11, 0x22, 0xA4, 0xA4)))
                .isEqualTo(HIRAGANA_A + UNDEFINED + HIRAGANA_I);
    }

    @Test
    void testDanglingByteBecomesPlaceholder() {
        assertThat(decoder.decode(bytes(0xA4, 0xA2, 0xFF))).isEqualTo(HIRAGANA_A + UNDEFINED);
    }

    @Test
    void testBlankMarkerBecomesFullWidthSpace() {
        assertThat(decoder.decode(bytes(0xA4, 0xA2, 0x42, 0x42, 0xA4, 0xA4)))
                .isEqualTo(HIRAGANA_A + FULL_WIDTH_SPACE + HIRAGANA_I);
    }

    @Test
    void testSurroundingFullWidthSpacesAreTrimmed() {
        assertThat(decoder.decode(bytes(0x42, 0x42, 0xA4, 0xA2, 0x42, 0x42))).isEqualTo(HIRAGANA_A);
        assertThat(decoder.decode(bytes(0x42, 0x42, 0x42, 0x42))).isEmpty();
    }

    @Test
    void testBlankMarkerWithoutSpaceMappingIsUndefined() {
        DoubleByteTextDecoder bare = new DoubleByteTextDecoder(
                CodeMappingTable.of(Map.of("A4A2", "3042")), DecoderSettings.defaults());

        assertThat(bare.decode(bytes(0xA4, 0xA2, 0x42, 0x42))).isEqualTo(HIRAGANA_A + UNDEFINED);
    }

    @Test
    void testEmptyTargetIsUndefined() {
        assertThat(decoder.decode(bytes(0xB0, 0xA1))).isEqualTo(UNDEFINED);
    }

    @Test
    void testCustomPlaceholder() {
        DecoderSettings settings = DecoderSettings.defaults().toBuilder().undefinedCharacter("?").build();
        DoubleByteTextDecoder custom = new DoubleByteTextDecoder(table, settings);

        assertThat(custom.decode(bytes(0x11, 0x22, 0xA4, 0xA2))).isEqualTo("?" + HIRAGANA_A);
    }

    @Test
    void testInvalidCodePointFails() {
        assertThatThrownBy(() -> decoder.decode(bytes(0xB0, 0xA2)))
                .isInstanceOf(InvalidCodePointException.class)
                .hasMessageContaining("110000");
    }

    @Test
    void testInputIsNotModified() {
        byte[] input = bytes(0x42, 0x42);

        decoder.decode(input);

        assertThat(input).containsExactly(0x42, 0x42);
    }

    private static byte[] bytes(int... values) {
        byte[] result = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (byte) values[i];
        }
        return result;
    }
}
