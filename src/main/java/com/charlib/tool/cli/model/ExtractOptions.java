package com.charlib.tool.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "extract" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ExtractOptions {

	@Option(names = { "--source", "-s" }, required = true, description = "Liberty library to read")
	private Path source;

	@Option(names = { "--process", "-p" }, defaultValue = "TT",
			description = "Process corner of the library: SS, TT or FF (default: ${DEFAULT-VALUE})")
	private String process;

	@Option(names = { "--output", "-o" }, description = "JSON file to write (defaults to standard output)")
	private Path output;

	@Option(names = { "--compact" }, description = "Write the JSON document without indentation")
	private boolean compact;
}
