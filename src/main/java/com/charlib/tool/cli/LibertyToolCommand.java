package com.charlib.tool.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Top-level {@code libtool} command. Does nothing on its own; see the subcommands.
 */
@Command(
        name = "libtool",
        mixinStandardHelpOptions = true,
        version = "liberty-charlib-tool 1.0.0",
        description = "Extracts characterization data from Liberty libraries and patches edits back.",
        subcommands = { ExtractCommand.class, PatchCommand.class }
)
public class LibertyToolCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing subcommand: extract or patch");
    }
}
