package com.mainframe.converter.conversion;

import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@NoArgsConstructor
public class DatasetDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(DatasetDiscoveryService.class);

    /**
     * Binary files directly inside {@code inputDir}, sorted by name.
     * The {@code .bin} extension matches in any case ({@code .BIN} as produced by
     * mainframe transfers); hidden files starting with a dot are skipped.
     * A missing directory yields an empty list.
     */
    public List<Path> discoverBinaryFiles(Path inputDir) throws IOException {
        if (!Files.isDirectory(inputDir)) {
            log.warn("Directory not found: {}", inputDir);
            return List.of();
        }
        try (Stream<Path> stream = Files.list(inputDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isBinaryFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    private boolean isBinaryFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return !name.startsWith(".") && name.endsWith("." + DatasetNaming.BINARY_EXTENSION);
    }
}
