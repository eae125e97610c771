package com.charlib.tool;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine;

class LibertyToolApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void testRunExtractsToFile() throws Exception {
        Path source = Path.of(getClass().getResource("/liberty/sample.lib").toURI());
        Path output = tempDir.resolve("sample.json");

        int exitCode = LibertyToolApplication.run("extract", "-s", source.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
        assertThat(new ObjectMapper().readTree(output.toFile()).at("/cells/0/cell_name").asText()).isEqualTo("INV1");
    }

    @Test
    void testRunRejectsMissingSource() {
        int exitCode = LibertyToolApplication.run("extract", "-s", tempDir.resolve("missing.lib").toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
