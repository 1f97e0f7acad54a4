package com.mainframe.converter.conversion;

import com.mainframe.converter.decode.DecoderSettings;
import lombok.Builder;
import lombok.Data;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Configuration for a conversion run.
 *
 * Directory defaults follow the usual working layout:
 * binaries in ./iBIN, layouts in ./iCPY, output in ./oDAT.
 */
@Data
@Builder
public class ConverterConfig {

    public static final Path DEFAULT_INPUT_DIR = Path.of("iBIN");
    public static final Path DEFAULT_COPYBOOK_DIR = Path.of("iCPY");
    public static final Path DEFAULT_OUTPUT_DIR = Path.of("oDAT");

    /**
     * Directory scanned for *.bin files.
     */
    @Builder.Default
    private Path inputDir = DEFAULT_INPUT_DIR;

    /**
     * Directory holding the CPY_*.txt layout files.
     */
    @Builder.Default
    private Path copybookDir = DEFAULT_COPYBOOK_DIR;

    /**
     * Directory receiving the LOAD_*.dat output files. Created when missing.
     */
    @Builder.Default
    private Path outputDir = DEFAULT_OUTPUT_DIR;

    /**
     * Double-byte code mapping file.
     */
    private Path mappingFile;

    @Builder.Default
    private Charset mappingCharset = StandardCharsets.UTF_16;

    @Builder.Default
    private DecoderSettings decoderSettings = DecoderSettings.defaults();
}
