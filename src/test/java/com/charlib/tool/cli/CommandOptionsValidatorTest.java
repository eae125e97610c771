package com.charlib.tool.cli;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.charlib.tool.cli.exception.OptionsValidationException;
import com.charlib.tool.cli.model.ExtractOptions;
import com.charlib.tool.cli.model.PatchOptions;
import com.charlib.tool.cli.validation.CommandOptionsValidator;
import com.charlib.tool.config.ExtractConfig;
import com.charlib.tool.config.PatchConfig;
import com.charlib.tool.model.ProcessCorner;

import picocli.CommandLine;

class CommandOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final CommandOptionsValidator validator = new CommandOptionsValidator();

    @Test
    void testExtractDefaults() throws Exception {
        Path source = Files.writeString(tempDir.resolve("a.lib"), "library (a) { }");

        ExtractConfig config = validator.validate(extractOptions("-s", source.toString()));

        assertThat(config.getSource()).isEqualTo(source);
        assertThat(config.getCorner()).isEqualTo(ProcessCorner.TT);
        assertThat(config.getOutput()).isNull();
        assertThat(config.isPretty()).isTrue();
    }

    @Test
    void testExtractUnknownCornerIsAccepted() throws Exception {
        Path source = Files.writeString(tempDir.resolve("a.lib"), "library (a) { }");

        ExtractConfig config = validator.validate(extractOptions("-s", source.toString(), "-p", "SF", "--compact"));

        assertThat(config.getCorner()).isEqualTo(ProcessCorner.UNKNOWN);
        assertThat(config.isPretty()).isFalse();
    }

    @Test
    void testExtractRejectsMissingSourceAndDirectoryOutput() {
        ExtractOptions options = extractOptions("-s", tempDir.resolve("missing.lib").toString(),
                "-o", tempDir.toString());

        assertThatThrownBy(() -> validator.validate(options))
                .hasMessageStartingWith("Invalid extract options:")
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(2)
                        .anySatisfy(error -> assertThat(error).contains("missing.lib"))
                        .anySatisfy(error -> assertThat(error).contains("is a directory")));
    }

    @Test
    void testPatchCollectsAllErrors() throws Exception {
        Path output = Files.writeString(tempDir.resolve("out.lib"), "existing");
        PatchOptions options = patchOptions("-s", tempDir.resolve("a.lib").toString(),
                "-e", tempDir.resolve("e.json").toString(), "-o", output.toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> {
                    assertThat(e.getCommand()).isEqualTo("patch");
                    assertThat(e.getErrors()).hasSize(3);
                })
                .hasMessageStartingWith("Invalid patch options:")
                .hasMessageContaining("--force");
    }

    @Test
    void testPatchForceAllowsExistingOutput() throws Exception {
        Path source = Files.writeString(tempDir.resolve("a.lib"), "library (a) { }");
        Path edits = Files.writeString(tempDir.resolve("e.json"), "{}");

        PatchConfig config = validator.validate(patchOptions("-s", source.toString(), "-e", edits.toString(),
                "-o", source.toString(), "-f"));

        assertThat(config.getOutput()).isEqualTo(source);
        assertThat(config.getEdits()).isEqualTo(edits);
    }

    private static ExtractOptions extractOptions(String... args) {
        return CommandLine.populateCommand(new ExtractOptions(), args);
    }

    private static PatchOptions patchOptions(String... args) {
        return CommandLine.populateCommand(new PatchOptions(), args);
    }
}
