package com.mainframe.converter;

import com.mainframe.converter.cli.ConvertCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Copybook Binary Converter.
 * Decodes fixed-length mainframe datasets (EBCDIC text, JEF double-byte text,
 * zoned and packed decimals) into quoted CSV files, one file per dataset.
 */
public class ConverterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand())
                .execute(args);
        System.exit(exitCode);
    }
}
