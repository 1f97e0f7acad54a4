package com.mainframe.converter.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.converter.cli.exception.OptionsValidationException;
import com.mainframe.converter.cli.model.ConvertOptions;
import com.mainframe.converter.cli.model.ValidatedConvertOptions;

import picocli.CommandLine;

class ConvertOptionsValidatorTest {

	@TempDir
	Path tempDir;

	private final ConvertOptionsValidator validator = new ConvertOptionsValidator();

	@Test
	void testDefaultsWithMappingFile() throws IOException {
		Path mapping = Files.writeString(tempDir.resolve("map.txt"), "A1A1,3000", StandardCharsets.UTF_16);

		ValidatedConvertOptions validated = validator.validate(parse("-m", mapping.toString()));

		assertThat(validated.getInputDir()).isEqualTo(Path.of("iBIN").toAbsolutePath().normalize());
		assertThat(validated.getCopybookDir().getFileName().toString()).isEqualTo("iCPY");
		assertThat(validated.getOutputDir().getFileName().toString()).isEqualTo("oDAT");
		assertThat(validated.getMappingCharset()).isEqualTo(StandardCharsets.UTF_16);
		assertThat(validated.getEncoding().name()).isEqualTo("IBM500");
	}

	@Test
	void testCustomEncodingAndDirectories() throws IOException {
		Path mapping = Files.writeString(tempDir.resolve("map.txt"), "A1A1,3000");
		Path in = Files.createDirectories(tempDir.resolve("in"));

		ValidatedConvertOptions validated = validator.validate(parse("-m", mapping.toString(), "-i", in.toString(),
				"-e", "cp037", "--mapping-charset", "UTF-8"));

		assertThat(validated.getInputDir()).isEqualTo(in.toAbsolutePath().normalize());
		assertThat(validated.getEncoding().name()).isEqualTo("IBM037");
		assertThat(validated.getMappingCharset()).isEqualTo(StandardCharsets.UTF_8);
	}

	@Test
	void testMissingMappingFile() {
		assertThatThrownBy(() -> validator.validate(parse()))
				.isInstanceOf(OptionsValidationException.class)
				.hasMessageContaining("Code mapping file is required");

		assertThatThrownBy(() -> validator.validate(parse("-m", tempDir.resolve("nope.txt").toString())))
				.isInstanceOf(OptionsValidationException.class)
				.hasMessageContaining("does not exist");
	}

	@Test
	void testAllProblemsReportedTogether() throws IOException {
		Path notADirectory = Files.writeString(tempDir.resolve("plain.txt"), "x");

		OptionsValidationException e = catchThrowableOfType(
				() -> validator.validate(parse("-i", notADirectory.toString(), "-o", notADirectory.toString(),
						"-e", "no-such-charset")),
				OptionsValidationException.class);

		assertThat(e.getErrors()).hasSize(4);
		assertThat(e.getErrors()).anyMatch(msg -> msg.contains("Input path is not a directory"));
		assertThat(e.getErrors()).anyMatch(msg -> msg.contains("Output path exists and is not a directory"));
		assertThat(e.getErrors()).anyMatch(msg -> msg.contains("Unsupported character set for --encoding"));
	}

	private static ConvertOptions parse(String... args) {
		ConvertOptions options = new ConvertOptions();
		new CommandLine(options).parseArgs(args);
		return options;
	}
}
