package com.mainframe.converter.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import lombok.Setter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "convert" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Option(names = { "--input-dir", "-i" }, defaultValue = "iBIN", description = "Directory containing binary datasets (*.bin)")
	private Path inputDir;

	@Option(names = { "--copybook-dir",
			"-c" }, defaultValue = "iCPY", description = "Directory containing record layouts (CPY_<name>.txt)")
	private Path copybookDir;

	@Option(names = { "--output-dir",
			"-o" }, defaultValue = "oDAT", description = "Directory receiving converted files (LOAD_<name>.dat); created if missing")
	private Path outputDir;

	// Prompted for interactively when omitted
	@Setter
	@Option(names = { "--mapping-file", "-m" }, description = "Double-byte code mapping file (SRC_HEX,DST_HEX per line)")
	private Path mappingFile;

	@Option(names = {
			"--mapping-charset" }, defaultValue = "UTF-16", description = "Character set of the mapping file (default: UTF-16, little-endian when no byte order mark)")
	private String mappingCharset;

	@Option(names = { "--encoding",
			"-e" }, defaultValue = "cp500", description = "Single-byte EBCDIC encoding (default: cp500; e.g. cp037, cp1047)")
	private String encoding;

}
