package com.mainframe.converter.pipeline;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of running one binary file through the record pipeline.
 */
@Value
@Builder
public class FileDecodeResult {
    int recordsWritten;

    /**
     * Field errors plus truncated records.
     */
    int errorCount;

    int fieldErrorCount;

    boolean truncated;

    /**
     * Byte offset where the incomplete trailing record starts; -1 when not truncated.
     */
    @Builder.Default
    long truncatedAtOffset = -1;

    public boolean isSuccess() {
        return errorCount == 0;
    }
}
