package com.mainframe.converter.conversion;

import com.mainframe.converter.decode.FieldDecoder;
import com.mainframe.converter.mapping.CodeMappingTable;
import com.mainframe.converter.parser.SchemaParser;
import com.mainframe.converter.util.FileWriteUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Converts every binary dataset of the input directory, one file after the other.
 * The mapping table and decoder are shared by all files.
 */
public class ConversionRunner {
    private static final Logger log = LoggerFactory.getLogger(ConversionRunner.class);

    private final ConverterConfig config;
    private final DatasetDiscoveryService discoveryService;
    private final FileConversionService conversionService;

    public ConversionRunner(ConverterConfig config, CodeMappingTable mappingTable) {
        this(config, new DatasetDiscoveryService(),
                new FileConversionService(new SchemaParser(), new FieldDecoder(mappingTable, config.getDecoderSettings())));
    }

    public ConversionRunner(ConverterConfig config, DatasetDiscoveryService discoveryService,
                            FileConversionService conversionService) {
        this.config = config;
        this.discoveryService = discoveryService;
        this.conversionService = conversionService;
    }

    public List<Path> discover() throws IOException {
        return discoveryService.discoverBinaryFiles(config.getInputDir());
    }

    /**
     * Convert the given binaries. {@code onResult} sees each result as soon as its file is done.
     */
    public RunSummary run(List<Path> binaryFiles, Consumer<ConversionResult> onResult) throws IOException {
        if (FileWriteUtil.createDirectories(config.getOutputDir())) {
            log.info("Created output directory: {}", config.getOutputDir());
        }

        RunSummary.RunSummaryBuilder summary = RunSummary.builder();
        for (Path binaryFile : binaryFiles) {
            Path schemaFile = DatasetNaming.copybookFor(binaryFile, config.getCopybookDir());
            Path outputFile = DatasetNaming.outputFor(binaryFile, config.getOutputDir());

            ConversionResult result = conversionService.convert(binaryFile, schemaFile, outputFile);
            onResult.accept(result);
            summary.result(result);
        }
        return summary.build();
    }
}
