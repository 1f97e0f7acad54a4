package com.mainframe.converter.cli.model;

import java.nio.charset.Charset;
import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Resolved values needed by the executor. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    Path inputDir;
    Path copybookDir;
    Path outputDir;
    Path mappingFile;
    Charset mappingCharset;
    Charset encoding;
}
