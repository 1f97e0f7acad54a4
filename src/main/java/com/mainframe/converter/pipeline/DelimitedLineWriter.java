package com.mainframe.converter.pipeline;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes comma-joined lines where every value is wrapped in double quotes and
 * embedded quotes are doubled. Lines end with a single LF.
 */
public class DelimitedLineWriter {

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final String ESCAPED_QUOTE = "\"\"";
    private static final char LINE_END = '\n';

    private final Writer out;

    public DelimitedLineWriter(Writer out) {
        this.out = out;
    }

    public void writeLine(List<String> values) throws IOException {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                line.append(DELIMITER);
            }
            line.append(quote(values.get(i)));
        }
        line.append(LINE_END);
        out.write(line.toString());
    }

    public void flush() throws IOException {
        out.flush();
    }

    static String quote(String value) {
        String safe = value == null ? "" : value;
        return QUOTE + safe.replace(String.valueOf(QUOTE), ESCAPED_QUOTE) + QUOTE;
    }
}
