package com.mainframe.converter.conversion;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class DatasetNamingTest {

    @Test
    void testBaseName() {
        assertThat(DatasetNaming.baseName(Path.of("in", "SALES.bin"))).isEqualTo("SALES");
        assertThat(DatasetNaming.baseName(Path.of("SALES.2024.BIN"))).isEqualTo("SALES.2024");
        assertThat(DatasetNaming.baseName(Path.of("NOEXT"))).isEqualTo("NOEXT");
    }

    @Test
    void testCompanionFiles() {
        Path binary = Path.of("iBIN", "SALES.bin");

        assertThat(DatasetNaming.copybookFor(binary, Path.of("iCPY"))).isEqualTo(Path.of("iCPY", "CPY_SALES.txt"));
        assertThat(DatasetNaming.outputFor(binary, Path.of("oDAT"))).isEqualTo(Path.of("oDAT", "LOAD_SALES.dat"));
    }
}
