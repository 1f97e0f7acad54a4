package com.mainframe.converter.cli.validation;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mainframe.converter.cli.exception.OptionsValidationException;
import com.mainframe.converter.cli.model.ConvertOptions;
import com.mainframe.converter.cli.model.ValidatedConvertOptions;

public class ConvertOptionsValidator {

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getMappingFile() == null || o.getMappingFile().toString().isBlank()) {
			errors.add("Code mapping file is required (--mapping-file / -m).");
		} else if (!Files.isRegularFile(o.getMappingFile())) {
			errors.add("Code mapping file does not exist: " + o.getMappingFile());
		}

		// A missing input directory is only a warning at discovery time; a plain file is a mistake
		if (o.getInputDir() != null && Files.exists(o.getInputDir()) && !Files.isDirectory(o.getInputDir())) {
			errors.add("Input path is not a directory: " + o.getInputDir());
		}
		if (o.getOutputDir() != null && Files.exists(o.getOutputDir()) && !Files.isDirectory(o.getOutputDir())) {
			errors.add("Output path exists and is not a directory: " + o.getOutputDir());
		}

		Charset mappingCharset = resolveCharset(o.getMappingCharset(), "--mapping-charset", errors);
		Charset encoding = resolveCharset(o.getEncoding(), "--encoding", errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedConvertOptions(normalize(o.getInputDir()), normalize(o.getCopybookDir()),
				normalize(o.getOutputDir()), normalize(o.getMappingFile()), mappingCharset, encoding);
	}

	private static Charset resolveCharset(String name, String option, List<String> errors) {
		if (name == null || name.isBlank()) {
			errors.add("Character set is required for " + option + ".");
			return null;
		}
		try {
			return Charset.forName(name.trim());
		} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			errors.add("Unsupported character set for " + option + ": " + name);
			return null;
		}
	}

	private static Path normalize(Path p) {
		return p.toAbsolutePath().normalize();
	}
}
