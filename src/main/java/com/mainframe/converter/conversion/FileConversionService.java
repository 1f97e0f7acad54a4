package com.mainframe.converter.conversion;

import com.mainframe.converter.decode.FieldDecoder;
import com.mainframe.converter.model.RecordSchema;
import com.mainframe.converter.parser.SchemaParseException;
import com.mainframe.converter.parser.SchemaParser;
import com.mainframe.converter.pipeline.FileDecodeResult;
import com.mainframe.converter.pipeline.RecordPipeline;
import com.mainframe.converter.util.FileWriteUtil;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts one binary dataset into one delimited text file.
 *
 * Every failure is reported through the returned {@link ConversionResult};
 * nothing here aborts the run.
 */
@RequiredArgsConstructor
public class FileConversionService {
    private static final Logger log = LoggerFactory.getLogger(FileConversionService.class);

    private final SchemaParser schemaParser;
    private final FieldDecoder fieldDecoder;

    public ConversionResult convert(Path binaryFile, Path schemaFile, Path outputFile) {
        String binaryName = binaryFile.getFileName().toString();
        String schemaName = schemaFile.getFileName().toString();
        log.info("Processing: {}", binaryName);
        log.info("  Using COPY: {}", schemaName);

        if (!Files.isRegularFile(binaryFile)) {
            log.error("Binary file not found: {}", binaryFile);
            return ConversionResult.failure(binaryName, ConversionStatus.BINARY_NOT_FOUND,
                    "Binary file not found: " + binaryFile);
        }
        if (!Files.isRegularFile(schemaFile)) {
            log.error("COPY file not found: {}", schemaFile);
            return ConversionResult.failure(binaryName, ConversionStatus.SCHEMA_NOT_FOUND,
                    "COPY file not found: " + schemaFile);
        }

        RecordSchema schema;
        try {
            schema = schemaParser.parse(schemaFile);
        } catch (SchemaParseException e) {
            log.error("Failed to parse COPY file {}: {}", schemaFile, e.getMessage());
            return ConversionResult.failure(binaryName, ConversionStatus.SCHEMA_PARSE_ERROR, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read COPY file {}: {}", schemaFile, e.getMessage());
            return ConversionResult.failure(binaryName, ConversionStatus.SCHEMA_PARSE_ERROR,
                    "Failed to read COPY file: " + e.getMessage());
        }

        FileDecodeResult decoded;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(binaryFile));
             Writer out = FileWriteUtil.newUtf8Writer(outputFile)) {
            decoded = new RecordPipeline(schema, fieldDecoder).run(in, out);
        } catch (IOException e) {
            log.error("Fatal error during file processing for {}: {}", binaryFile, e.getMessage(), e);
            return ConversionResult.failure(binaryName, ConversionStatus.PROCESSING_ERROR, e.getMessage());
        }

        log.info("  Finished processing. Records processed: {}. Errors encountered for this file: {}.",
                decoded.getRecordsWritten(), decoded.getErrorCount());

        return ConversionResult.builder()
                .binaryFileName(binaryName)
                .schemaFileName(schemaName)
                .outputPath(outputFile)
                .status(decoded.isSuccess() ? ConversionStatus.SUCCESS : ConversionStatus.PROCESSING_ERROR)
                .errorMessage(decoded.isSuccess() ? null : decoded.getErrorCount() + " error(s) encountered")
                .recordsWritten(decoded.getRecordsWritten())
                .errorCount(decoded.getErrorCount())
                .build();
    }
}
