package com.mainframe.converter.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table translating a two-byte legacy code (4 hex digits) into a
 * Unicode code point (hex). Keys and values are stored upper-case.
 */
public final class CodeMappingTable {

    private final Map<String, String> entries;
    private final List<String> warnings;

    public CodeMappingTable(Map<String, String> entries, List<String> warnings) {
        Map<String, String> normalized = new LinkedHashMap<>();
        entries.forEach((source, target) -> normalized.put(normalize(source), normalize(target)));
        this.entries = Collections.unmodifiableMap(normalized);
        this.warnings = List.copyOf(warnings);
    }

    public static CodeMappingTable of(Map<String, String> entries) {
        return new CodeMappingTable(entries, List.of());
    }

    /**
     * Look up the target hex string for a source key. An empty result means
     * the code is undefined, which is not an error.
     */
    public Optional<String> lookup(String sourceHex) {
        if (sourceHex == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(normalize(sourceHex)));
    }

    public boolean contains(String sourceHex) {
        return lookup(sourceHex).isPresent();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<String> getWarnings() {
        return warnings;
    }

    private static String normalize(String hex) {
        return hex.trim().toUpperCase(Locale.ROOT);
    }
}
