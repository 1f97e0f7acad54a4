package com.mainframe.converter.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One elementary field of a fixed-length record layout.
 */
@Value
@Builder
public class FieldDefinition {
    @NonNull
    String name;

    /**
     * Upper-cased type code as written in the layout, e.g. {@code X}, {@code 9(5)V9(2)}, {@code PS9(7)}.
     */
    @NonNull
    String typeToken;

    /**
     * Explicit decimal-place count; null when the layout leaves it empty.
     */
    Integer numericAttribute;

    int byteLength;

    /**
     * Zero-based offset into the record, as computed from preceding field lengths.
     */
    int offset;

    @NonNull
    FieldType fieldType;

    @NonNull
    PictureClause picture;

    /**
     * Build a field, resolving its decode variant and digit counts from the type token.
     */
    public static FieldDefinition of(String name, String typeToken, Integer numericAttribute, int byteLength, int offset) {
        return FieldDefinition.builder()
                .name(name)
                .typeToken(typeToken)
                .numericAttribute(numericAttribute)
                .byteLength(byteLength)
                .offset(offset)
                .fieldType(FieldType.fromTypeToken(typeToken))
                .picture(PictureClause.parse(typeToken))
                .build();
    }

    public int getEndOffset() {
        return offset + byteLength;
    }

    public boolean hasNumericAttribute() {
        return numericAttribute != null;
    }
}
