package com.mainframe.converter.conversion;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Result of converting one binary file.
 */
@Data
@Builder
public class ConversionResult {
    private String binaryFileName;
    private String schemaFileName;
    private Path outputPath;
    private ConversionStatus status;
    private String errorMessage;

    private int recordsWritten;
    private int errorCount;

    public boolean isSuccess() {
        return status != null && status.isSuccess();
    }

    public static ConversionResult failure(String binaryFileName, ConversionStatus status, String errorMessage) {
        return ConversionResult.builder()
                .binaryFileName(binaryFileName)
                .status(status)
                .errorMessage(errorMessage)
                .build();
    }
}
