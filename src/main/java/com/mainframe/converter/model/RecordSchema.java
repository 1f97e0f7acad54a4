package com.mainframe.converter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Parsed record layout: the fixed record length and its fields in offset order.
 */
@Value
@Builder
public class RecordSchema {
    int recordLength;

    @Singular
    List<FieldDefinition> fields;

    /**
     * Non-fatal problems noticed while parsing the layout.
     */
    @Singular
    List<String> warnings;

    public List<String> getFieldNames() {
        return fields.stream().map(FieldDefinition::getName).toList();
    }

    /**
     * Sum of all field lengths. May be less than the record length.
     */
    public int getCoveredLength() {
        return fields.stream().mapToInt(FieldDefinition::getByteLength).sum();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
