package com.mainframe.converter.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.converter.cli.model.ValidatedConvertOptions;
import com.mainframe.converter.conversion.ConversionResult;
import com.mainframe.converter.conversion.RunSummary;
import com.mainframe.converter.mapping.CodeMappingTable;

/**
 * Responsible only for printing CLI output for the "convert" command.
 * No validation, no execution, no prompting.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    public void printBanner(ValidatedConvertOptions v) {
        log.info("=================================================");
        log.info("Copybook Binary Converter");
        log.info("=================================================");
        log.info("Input Directory: {}", v.getInputDir());
        log.info("Copybook Directory: {}", v.getCopybookDir());
        log.info("Output Directory: {}", v.getOutputDir());
        log.info("Mapping File: {} ({})", v.getMappingFile(), v.getMappingCharset().name());
        log.info("Encoding: {}", v.getEncoding().name());
        log.info("=================================================");
    }

    public void printMappingLoaded(CodeMappingTable table) {
        log.info("Code mappings loaded: {}", table.size());
        if (!table.getWarnings().isEmpty()) {
            log.warn("Malformed mapping lines skipped: {}", table.getWarnings().size());
        }
    }

    public void printFilesFound(int count) {
        log.info("Found {} binary files to process.", count);
    }

    public void printNoFiles(ValidatedConvertOptions v) {
        log.warn("No .bin files found in {}. Exiting.", v.getInputDir());
    }

    public void printFileStatus(ConversionResult result) {
        if (result.isSuccess()) {
            log.info("Status: {} - {}", result.getStatus().getLabel(), result.getBinaryFileName());
        } else {
            log.error("Status: {} - {}", result.getStatus().getLabel(), result.getBinaryFileName());
        }
        log.info("");
    }

    public void printSummary(RunSummary summary) {
        log.info("--- Processing Summary ---");
        log.info("Total files attempted: {}", summary.getAttempted());
        log.info("Successful conversions: {}", summary.getSucceeded());
        log.info("Failed conversions: {}", summary.getFailed());
    }
}
