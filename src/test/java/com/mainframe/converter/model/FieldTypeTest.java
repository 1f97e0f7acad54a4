package com.mainframe.converter.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class FieldTypeTest {

    @ParameterizedTest
    @CsvSource({
        "X,           ALPHANUMERIC",
        "9,           ZONED_INTEGER",
        "N,           DOUBLE_BYTE",
        "9(5)V9(2),   ZONED_SCALED",
        "9V9,         ZONED_SCALED",
        "V9(3),       ZONED_LEADING_DECIMAL",
        "V9,          ZONED_LEADING_DECIMAL",
        "P9(5),       PACKED_DECIMAL",
        "PS9(5)V9(2), PACKED_DECIMAL",
        "S9(7),       PACKED_DECIMAL",
        "SP9(3),      PACKED_DECIMAL",
        "PV9,         PACKED_DECIMAL",
        "PSV9,        PACKED_DECIMAL",
        "PV9(2),      UNSUPPORTED",
        "X(10),       UNSUPPORTED",
        "9(5),        UNSUPPORTED",
        "COMP,        UNSUPPORTED"
    })
    void testFromTypeToken(String token, FieldType expected) {
        assertThat(FieldType.fromTypeToken(token)).isEqualTo(expected);
    }

    @Test
    void testLowerCaseTokenIsNormalized() {
        assertThat(FieldType.fromTypeToken("x")).isEqualTo(FieldType.ALPHANUMERIC);
        assertThat(FieldType.fromTypeToken("ps9(3)")).isEqualTo(FieldType.PACKED_DECIMAL);
    }

    @Test
    void testBlankTokenIsUnsupported() {
        assertThat(FieldType.fromTypeToken("")).isEqualTo(FieldType.UNSUPPORTED);
        assertThat(FieldType.fromTypeToken(null)).isEqualTo(FieldType.UNSUPPORTED);
    }

    @Test
    void testPackedScaleOnly() {
        assertThat(FieldType.isPackedScaleOnly("PV9")).isTrue();
        assertThat(FieldType.isPackedScaleOnly("PSV9")).isTrue();
        assertThat(FieldType.isPackedScaleOnly("PS9(3)V9(2)")).isFalse();
    }
}
