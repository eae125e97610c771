package com.charlib.tool;

import com.charlib.tool.cli.LibertyToolCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Liberty characterization library tool.
 * Extracts timing/power data of a Liberty library to JSON and patches JSON edits back.
 */
public class LibertyToolApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new LibertyToolCommand()).execute(args);
    }
}
