package com.charlib.tool.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "patch" command.
 */
@Getter
public class PatchOptions {

	@Option(names = { "--source", "-s" }, required = true, description = "Liberty library to patch")
	private Path source;

	@Option(names = { "--edits", "-e" }, required = true, description = "JSON edit document")
	private Path edits;

	@Option(names = { "--output", "-o" }, required = true, description = "Liberty file to write")
	private Path output;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;
}
