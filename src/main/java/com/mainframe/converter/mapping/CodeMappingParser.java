package com.mainframe.converter.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parser for double-byte code mapping files.
 *
 * Format:
 * - Mapping: 4242,3000 (source code hex, target Unicode code point hex)
 * - Comments: # comment
 * - Blank lines are ignored
 *
 * Mapping files are usually saved as UTF-16. Without a byte order mark they
 * are read as little-endian.
 */
public class CodeMappingParser {
    private static final Logger log = LoggerFactory.getLogger(CodeMappingParser.class);

    public static final Charset DEFAULT_CHARSET = StandardCharsets.UTF_16;

    private static final Pattern HEX_PATTERN = Pattern.compile("[0-9A-F]+");

    public CodeMappingTable parse(Path mappingFile) {
        return parse(mappingFile, DEFAULT_CHARSET);
    }

    public CodeMappingTable parse(Path mappingFile, Charset charset) {
        if (!Files.isRegularFile(mappingFile)) {
            throw new MappingLoadException("Code mapping file not found: " + mappingFile);
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(mappingFile, resolveByteOrder(mappingFile, charset));
        } catch (CharacterCodingException e) {
            throw new MappingLoadException("Code mapping file " + mappingFile + " is not valid " + charset.name(), e);
        } catch (IOException e) {
            throw new MappingLoadException("Failed to read code mapping file " + mappingFile + ": " + e.getMessage(), e);
        }
        log.info("Loading code mapping: {}", mappingFile);
        return parse(lines);
    }

    public CodeMappingTable parse(List<String> lines) {
        Map<String, String> entries = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = stripByteOrderMark(line).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            String[] parts = trimmed.split(",", -1);
            if (parts.length != 2) {
                skip(warnings, lineNum, trimmed);
                continue;
            }

            String source = parts[0].trim().toUpperCase(Locale.ROOT);
            String target = parts[1].trim().toUpperCase(Locale.ROOT);
            if (!HEX_PATTERN.matcher(source).matches() || !HEX_PATTERN.matcher(target).matches()) {
                skip(warnings, lineNum, trimmed);
                continue;
            }

            entries.put(source, target);
        }

        log.debug("Loaded {} code mappings ({} lines skipped)", entries.size(), warnings.size());
        return new CodeMappingTable(entries, warnings);
    }

    private void skip(List<String> warnings, int lineNum, String line) {
        String message = "Skipping malformed code mapping line " + lineNum + ": " + line;
        log.warn(message);
        warnings.add(message);
    }

    /**
     * UTF-16 without a byte order mark is read as little-endian, the byte order
     * Windows editors write. With a mark, the mark decides.
     */
    private static Charset resolveByteOrder(Path mappingFile, Charset charset) throws IOException {
        if (!StandardCharsets.UTF_16.equals(charset)) {
            return charset;
        }
        byte[] head;
        try (InputStream in = Files.newInputStream(mappingFile)) {
            head = in.readNBytes(2);
        }
        if (head.length == 2 && isByteOrderMark(head[0] & 0xFF, head[1] & 0xFF)) {
            return charset;
        }
        log.debug("No byte order mark in {}, reading as {}", mappingFile, StandardCharsets.UTF_16LE.name());
        return StandardCharsets.UTF_16LE;
    }

    private static boolean isByteOrderMark(int first, int second) {
        return (first == 0xFE && second == 0xFF) || (first == 0xFF && second == 0xFE);
    }

    private static String stripByteOrderMark(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
