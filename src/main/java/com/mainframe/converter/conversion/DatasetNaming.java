package com.mainframe.converter.conversion;

import lombok.experimental.UtilityClass;

import java.nio.file.Path;

/**
 * File naming rules linking a binary dataset to its layout and output:
 * {@code SALES.bin} is described by {@code CPY_SALES.txt} and written to {@code LOAD_SALES.dat}.
 */
@UtilityClass
public class DatasetNaming {

    public static final String BINARY_EXTENSION = "bin";
    public static final String COPYBOOK_PREFIX = "CPY_";
    public static final String COPYBOOK_EXTENSION = "txt";
    public static final String OUTPUT_PREFIX = "LOAD_";
    public static final String OUTPUT_EXTENSION = "dat";

    public static String baseName(Path binaryFile) {
        String file = binaryFile.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    public static Path copybookFor(Path binaryFile, Path copybookDir) {
        return copybookDir.resolve(COPYBOOK_PREFIX + baseName(binaryFile) + "." + COPYBOOK_EXTENSION);
    }

    public static Path outputFor(Path binaryFile, Path outputDir) {
        return outputDir.resolve(OUTPUT_PREFIX + baseName(binaryFile) + "." + OUTPUT_EXTENSION);
    }
}
