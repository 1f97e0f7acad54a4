package com.mainframe.converter.parser;

import com.mainframe.converter.model.FieldDefinition;
import com.mainframe.converter.model.RecordSchema;
import com.mainframe.converter.parser.SchemaParseException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Parser for flat record layout files.
 *
 * Format:
 * - Line 1: record length in bytes
 * - Line 2: reserved, ignored
 * - Line 3+: NAME,TYPE,NUMERIC-ATTRIBUTE,BYTE-LENGTH,OFFSET (offset is 1-based,
 *   numeric attribute may be empty)
 *
 * Offsets are recomputed from the field lengths; a declared offset that disagrees
 * only produces a warning.
 */
public class SchemaParser {
    private static final Logger log = LoggerFactory.getLogger(SchemaParser.class);

    private static final String DELIMITER = ",";
    private static final int FIELD_PART_COUNT = 5;
    private static final int FIRST_FIELD_LINE = 3;

    public RecordSchema parse(Path schemaFile) throws IOException {
        List<String> lines = Files.readAllLines(schemaFile, StandardCharsets.UTF_8);
        return parse(lines);
    }

    public RecordSchema parse(List<String> rawLines) {
        List<String> lines = rawLines.stream().map(String::trim).toList();

        int recordLength = parseRecordLength(lines);
        RecordSchema.RecordSchemaBuilder schema = RecordSchema.builder().recordLength(recordLength);

        int runningOffset = 0;
        int fieldCount = 0;

        for (int index = FIRST_FIELD_LINE - 1; index < lines.size(); index++) {
            int lineNum = index + 1;
            String line = lines.get(index);
            List<String> parts = splitParts(line);

            if (parts.size() != FIELD_PART_COUNT) {
                warn(schema, String.format("Skipping malformed line %d: '%s' - expected %d parts, got %d",
                        lineNum, line, FIELD_PART_COUNT, parts.size()));
                continue;
            }

            String name = parts.get(0).trim();
            String typeToken = parts.get(1).trim().toUpperCase(Locale.ROOT);
            String numericAttribute = parts.get(2).trim();

            int byteLength;
            int declaredOffset;
            try {
                byteLength = Integer.parseInt(parts.get(3).trim());
                declaredOffset = Integer.parseInt(parts.get(4).trim());
            } catch (NumberFormatException e) {
                warn(schema, String.format("Skipping line %d with malformed numeric value: '%s' - %s",
                        lineNum, line, e.getMessage()));
                continue;
            }

            if (byteLength <= 0) {
                warn(schema, String.format("Skipping field with invalid byte length (%d) on line %d: '%s'",
                        byteLength, lineNum, line));
                continue;
            }

            if (declaredOffset != runningOffset + 1) {
                warn(schema, String.format("Offset mismatch on line %d. Declared: %d, Calculated: %d. Using calculated offset (%d).",
                        lineNum, declaredOffset, runningOffset + 1, runningOffset));
            }

            // Compared as remaining room so huge lengths cannot wrap around
            if (byteLength > recordLength - runningOffset) {
                throw new SchemaParseException(Reason.FIELD_EXCEEDS_RECORD,
                        String.format("Field definition exceeds record length (line %d). Field '%s' ends at byte %d, record length is %d.",
                                lineNum, name, (long) runningOffset + byteLength, recordLength));
            }

            schema.field(FieldDefinition.of(name, typeToken, parseNumericAttribute(numericAttribute),
                    byteLength, runningOffset));
            log.debug("Parsed field {} ({}) at offset {} length {}", name, typeToken, runningOffset, byteLength);

            runningOffset += byteLength;
            fieldCount++;
        }

        if (runningOffset != recordLength) {
            warn(schema, String.format("Total calculated field length (%d) does not match declared record length (%d).",
                    runningOffset, recordLength));
        }

        if (fieldCount == 0) {
            throw new SchemaParseException(Reason.NO_FIELDS, "No valid field definitions found in layout");
        }

        return schema.build();
    }

    private int parseRecordLength(List<String> lines) {
        if (lines.isEmpty()) {
            throw new SchemaParseException(Reason.INVALID_RECORD_LENGTH, "Layout is empty, record length missing");
        }
        String header = lines.get(0);
        int recordLength;
        try {
            recordLength = Integer.parseInt(header);
        } catch (NumberFormatException e) {
            throw new SchemaParseException(Reason.INVALID_RECORD_LENGTH,
                    "Invalid record length (not a number) in layout header: '" + header + "'");
        }
        if (recordLength <= 0) {
            throw new SchemaParseException(Reason.INVALID_RECORD_LENGTH,
                    "Invalid record length (" + recordLength + ") in layout header");
        }
        return recordLength;
    }

    /**
     * Split a field line. A 4-part line with a blank third part gets an empty
     * numeric-attribute slot inserted so it lines up with the 5-part format.
     */
    private List<String> splitParts(String line) {
        List<String> parts = new ArrayList<>(Arrays.asList(line.split(DELIMITER, -1)));
        if (parts.size() == FIELD_PART_COUNT - 1 && parts.get(2).isBlank()) {
            parts.add(2, "");
        }
        return parts;
    }

    private Integer parseNumericAttribute(String raw) {
        if (raw.isEmpty() || !raw.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return null;
        }
        try {
            return Integer.valueOf(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void warn(RecordSchema.RecordSchemaBuilder schema, String message) {
        log.warn(message);
        schema.warning(message);
    }
}
