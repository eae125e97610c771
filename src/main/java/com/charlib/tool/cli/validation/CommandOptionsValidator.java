package com.charlib.tool.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.charlib.tool.cli.exception.OptionsValidationException;
import com.charlib.tool.cli.model.ExtractOptions;
import com.charlib.tool.cli.model.PatchOptions;
import com.charlib.tool.config.ExtractConfig;
import com.charlib.tool.config.PatchConfig;
import com.charlib.tool.model.ProcessCorner;

/**
 * Checks command options and turns them into run configs. All problems are reported at once.
 */
public class CommandOptionsValidator {

	public ExtractConfig validate(ExtractOptions o) {
		List<String> errors = new ArrayList<>();

		checkSourceFile(o.getSource(), "Liberty source", errors);

		if (o.getOutput() != null && Files.isDirectory(o.getOutput())) {
			errors.add("Output path is a directory: " + o.getOutput());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException("extract", errors);
		}

		return ExtractConfig.builder()
				.source(o.getSource())
				.corner(ProcessCorner.fromName(o.getProcess()))
				.output(o.getOutput())
				.pretty(!o.isCompact())
				.build();
	}

	public PatchConfig validate(PatchOptions o) {
		List<String> errors = new ArrayList<>();

		checkSourceFile(o.getSource(), "Liberty source", errors);
		checkSourceFile(o.getEdits(), "Edit document", errors);

		if (o.getOutput() == null) {
			errors.add("Output file is required (--output / -o).");
		} else if (Files.isDirectory(o.getOutput())) {
			errors.add("Output path is a directory: " + o.getOutput());
		} else if (Files.exists(o.getOutput()) && !o.isForce()) {
			errors.add("Output file already exists: " + o.getOutput() + ". Use --force to overwrite.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException("patch", errors);
		}

		return PatchConfig.builder()
				.source(o.getSource())
				.edits(o.getEdits())
				.output(o.getOutput())
				.build();
	}

	private static void checkSourceFile(Path p, String label, List<String> errors) {
		if (p == null) {
			errors.add(label + " is required.");
		} else if (!Files.isRegularFile(p)) {
			errors.add(label + " does not exist or is not a file: " + p);
		}
	}
}
