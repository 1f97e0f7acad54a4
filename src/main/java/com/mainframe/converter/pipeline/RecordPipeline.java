package com.mainframe.converter.pipeline;

import com.mainframe.converter.decode.FieldDecoder;
import com.mainframe.converter.decode.FieldValue;
import com.mainframe.converter.model.FieldDefinition;
import com.mainframe.converter.model.RecordSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Streams fixed-length records from a binary source and writes one quoted,
 * comma-delimited line per record.
 *
 * Field errors are written inline as error tokens and counted. A trailing
 * record shorter than the record length is counted as one error and ends the
 * file; its bytes are not decoded.
 */
public class RecordPipeline {
    private static final Logger log = LoggerFactory.getLogger(RecordPipeline.class);

    private final RecordSchema schema;
    private final FieldDecoder fieldDecoder;

    public RecordPipeline(RecordSchema schema, FieldDecoder fieldDecoder) {
        this.schema = schema;
        this.fieldDecoder = fieldDecoder;
    }

    public FileDecodeResult run(InputStream in, Writer out) throws IOException {
        DelimitedLineWriter writer = new DelimitedLineWriter(out);
        writer.writeLine(schema.getFieldNames());

        ErrorTally tally = new ErrorTally();
        int recordLength = schema.getRecordLength();
        long position = 0;
        int recordsWritten = 0;
        boolean truncated = false;
        long truncatedAt = -1;

        while (true) {
            // Buffer grows with the bytes actually read, not the declared length
            byte[] record = in.readNBytes(recordLength);
            int read = record.length;
            if (read == 0) {
                break;
            }
            if (read < recordLength) {
                log.warn("Incomplete record read at byte offset {}. Expected {} bytes, got {}. Skipping remaining data in this file.",
                        position, recordLength, read);
                tally.recordTruncated();
                truncated = true;
                truncatedAt = position;
                break;
            }

            writer.writeLine(decodeRecord(record, tally));
            recordsWritten++;
            position += read;
        }

        writer.flush();

        return FileDecodeResult.builder()
                .recordsWritten(recordsWritten)
                .errorCount(tally.total())
                .fieldErrorCount(tally.fieldErrors)
                .truncated(truncated)
                .truncatedAtOffset(truncatedAt)
                .build();
    }

    private List<String> decodeRecord(byte[] record, ErrorTally tally) {
        List<String> values = new ArrayList<>(schema.getFields().size());
        for (FieldDefinition field : schema.getFields()) {
            byte[] bytes = Arrays.copyOfRange(record, field.getOffset(), field.getEndOffset());
            FieldValue value = fieldDecoder.decode(field, bytes);
            if (value.isError()) {
                tally.fieldFailed();
            }
            values.add(value.toOutputText());
        }
        return values;
    }

    /**
     * Error counts for a single run.
     */
    private static final class ErrorTally {
        private int fieldErrors;
        private int recordErrors;

        void fieldFailed() {
            fieldErrors++;
        }

        void recordTruncated() {
            recordErrors++;
        }

        int total() {
            return fieldErrors + recordErrors;
        }
    }
}
