package com.mainframe.converter.cli;

import com.mainframe.converter.cli.exception.OptionsValidationException;
import com.mainframe.converter.cli.model.ConvertOptions;
import com.mainframe.converter.cli.model.ValidatedConvertOptions;
import com.mainframe.converter.cli.output.ConvertResultsPrinter;
import com.mainframe.converter.cli.validation.ConvertOptionsValidator;
import com.mainframe.converter.conversion.ConversionRunner;
import com.mainframe.converter.conversion.ConverterConfig;
import com.mainframe.converter.conversion.RunSummary;
import com.mainframe.converter.decode.DecoderSettings;
import com.mainframe.converter.mapping.CodeMappingParser;
import com.mainframe.converter.mapping.CodeMappingTable;
import com.mainframe.converter.mapping.MappingLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.Console;
import java.nio.file.Path;
import java.util.List;
import java.util.Scanner;
import java.util.concurrent.Callable;

/**
 * CLI command converting mainframe binary datasets into delimited text files.
 */
@Command(
        name = "convert",
        mixinStandardHelpOptions = true,
        version = "copybook-binary-converter 1.0.0",
        description = "Converts fixed-length EBCDIC/JEF binary datasets into quoted CSV text using flat record layouts."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Mixin
    private ConvertOptions options = new ConvertOptions();

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();

    @Override
    public Integer call() {
        try {
            // Interactive prompt for the mapping file when not given
            if (options.getMappingFile() == null) {
                String entered = promptForInput("Enter the path of the code mapping file: ");
                if (entered != null && !entered.isBlank()) {
                    options.setMappingFile(Path.of(entered.trim()));
                }
            }

            ValidatedConvertOptions validated = validator.validate(options);
            printer.printBanner(validated);

            CodeMappingTable mappingTable = new CodeMappingParser()
                    .parse(validated.getMappingFile(), validated.getMappingCharset());
            if (mappingTable.isEmpty()) {
                log.error("Code mapping is empty or failed to load. Exiting.");
                return EXIT_FAILURE;
            }
            printer.printMappingLoaded(mappingTable);

            ConverterConfig config = ConverterConfig.builder()
                    .inputDir(validated.getInputDir())
                    .copybookDir(validated.getCopybookDir())
                    .outputDir(validated.getOutputDir())
                    .mappingFile(validated.getMappingFile())
                    .mappingCharset(validated.getMappingCharset())
                    .decoderSettings(DecoderSettings.builder()
                            .singleByteCharset(validated.getEncoding())
                            .build())
                    .build();

            ConversionRunner runner = new ConversionRunner(config, mappingTable);
            List<Path> binaryFiles = runner.discover();
            if (binaryFiles.isEmpty()) {
                printer.printNoFiles(validated);
                return EXIT_OK;
            }

            printer.printFilesFound(binaryFiles.size());
            RunSummary summary = runner.run(binaryFiles, printer::printFileStatus);
            printer.printSummary(summary);

            return summary.hasFailures() ? EXIT_FAILURE : EXIT_OK;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return EXIT_FAILURE;
        } catch (MappingLoadException e) {
            log.error(e.getMessage());
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Conversion failed with exception", e);
            return EXIT_FAILURE;
        }
    }

    protected String promptForInput(String prompt) {
        Console console = System.console();
        if (console != null) {
            return console.readLine(prompt);
        }
        // Fallback for non-interactive environments
        System.out.print(prompt);
        Scanner scanner = new Scanner(System.in);
        return scanner.hasNextLine() ? scanner.nextLine() : null;
    }
}
