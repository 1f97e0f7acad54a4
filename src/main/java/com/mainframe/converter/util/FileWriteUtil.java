package com.mainframe.converter.util;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for output file handling with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Opens a UTF-8 writer, creating parent directories if needed. Existing files are replaced.
     */
    public static BufferedWriter newUtf8Writer(Path filePath) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        return Files.newBufferedWriter(filePath, StandardCharsets.UTF_8);
    }

    /**
     * Creates a directory and its parents; returns true when it did not exist before.
     */
    public static boolean createDirectories(Path dir) throws IOException {
        if (Files.isDirectory(dir)) {
            return false;
        }
        Files.createDirectories(dir);
        return true;
    }
}
