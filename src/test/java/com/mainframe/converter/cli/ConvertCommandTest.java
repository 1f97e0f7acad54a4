package com.mainframe.converter.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for the convert command: directories on disk in, exit code and files out.
 */
class ConvertCommandTest {

    private static final Charset CP500 = Charset.forName("cp500");

    @TempDir
    Path tempDir;

    private Path inputDir;
    private Path copybookDir;
    private Path outputDir;
    private Path mappingFile;

    @BeforeEach
    void setUp() throws IOException {
        inputDir = Files.createDirectories(tempDir.resolve("iBIN"));
        copybookDir = Files.createDirectories(tempDir.resolve("iCPY"));
        outputDir = tempDir.resolve("oDAT");
        mappingFile = tempDir.resolve("JEF_UNICODE.txt");
        Files.writeString(mappingFile, "# JEF -> Unicode\r\nA4A2,3042\r\nA1A1,3000\r\n", StandardCharsets.UTF_16);
    }

    @Test
    void testConvertDirectory() throws IOException {
        Files.write(inputDir.resolve("CUSTOMER.bin"), concat(
                "C01".getBytes(CP500), new byte[] {0x12, 0x34, 0x56, 0x7C}, new byte[] {(byte) 0xA4, (byte) 0xA2, 0x42, 0x42}));
        Files.writeString(copybookDir.resolve("CPY_CUSTOMER.txt"),
                "11\nCUSTOMER\nID,X,,3,1\nBALANCE,PS9(5)V9(2),,4,4\nNAME,N,,4,8\n");

        int exitCode = execute();

        assertThat(exitCode).isEqualTo(ConvertCommand.EXIT_OK);
        Path output = outputDir.resolve("LOAD_CUSTOMER.dat");
        assertThat(Files.readString(output, StandardCharsets.UTF_8))
                .isEqualTo("\"ID\",\"BALANCE\",\"NAME\"\n\"C01\",\"12345.67\",\"あ\"\n");
    }

    @Test
    void testAnyFailedFileGivesFailureExitCode() throws IOException {
        Files.write(inputDir.resolve("GOOD.bin"), "AB".getBytes(CP500));
        Files.write(inputDir.resolve("ORPHAN.bin"), "AB".getBytes(CP500));
        Files.writeString(copybookDir.resolve("CPY_GOOD.txt"), "2\n\nF,X,,2,1\n");

        int exitCode = execute();

        assertThat(exitCode).isEqualTo(ConvertCommand.EXIT_FAILURE);
        assertThat(Files.exists(outputDir.resolve("LOAD_GOOD.dat"))).isTrue();
        assertThat(Files.exists(outputDir.resolve("LOAD_ORPHAN.dat"))).isFalse();
    }

    @Test
    void testNoBinaryFilesIsNotAnError() {
        int exitCode = execute();

        assertThat(exitCode).isEqualTo(ConvertCommand.EXIT_OK);
    }

    @Test
    void testEmptyMappingIsFatal() throws IOException {
        Files.writeString(mappingFile, "# nothing here\r\n", StandardCharsets.UTF_16);
        Files.write(inputDir.resolve("DATA.bin"), "AB".getBytes(CP500));
        Files.writeString(copybookDir.resolve("CPY_DATA.txt"), "2\n\nF,X,,2,1\n");

        int exitCode = execute();

        assertThat(exitCode).isEqualTo(ConvertCommand.EXIT_FAILURE);
        assertThat(Files.exists(outputDir.resolve("LOAD_DATA.dat"))).isFalse();
    }

    @Test
    void testMappingFileIsPromptedWhenOmitted() {
        PromptingCommand command = new PromptingCommand(mappingFile.toString());

        int exitCode = new CommandLine(command).execute(
                "-i", inputDir.toString(), "-c", copybookDir.toString(), "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(ConvertCommand.EXIT_OK);
        assertThat(command.prompts).isEqualTo(1);
    }

    @Test
    void testNoAnswerToPromptFails() {
        int exitCode = new CommandLine(new PromptingCommand(null)).execute(
                "-i", inputDir.toString(), "-c", copybookDir.toString(), "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(ConvertCommand.EXIT_FAILURE);
    }

    @Test
    void testUnknownEncodingFails() {
        int exitCode = new CommandLine(new ConvertCommand()).execute(
                "-i", inputDir.toString(), "-c", copybookDir.toString(), "-o", outputDir.toString(),
                "-m", mappingFile.toString(), "-e", "no-such-charset");

        assertThat(exitCode).isEqualTo(ConvertCommand.EXIT_FAILURE);
    }

    private int execute() {
        return new CommandLine(new ConvertCommand()).execute(
                "-i", inputDir.toString(),
                "-c", copybookDir.toString(),
                "-o", outputDir.toString(),
                "-m", mappingFile.toString());
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    static class PromptingCommand extends ConvertCommand {
        private final String answer;
        private int prompts;

        PromptingCommand(String answer) {
            this.answer = answer;
        }

        @Override
        protected String promptForInput(String prompt) {
            prompts++;
            return answer;
        }
    }
}
