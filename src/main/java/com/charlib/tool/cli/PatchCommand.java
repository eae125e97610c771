package com.charlib.tool.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.cli.exception.OptionsValidationException;
import com.charlib.tool.cli.model.PatchOptions;
import com.charlib.tool.cli.output.ResultsPrinter;
import com.charlib.tool.cli.validation.CommandOptionsValidator;
import com.charlib.tool.config.PatchConfig;
import com.charlib.tool.service.LibertyPatchService;
import com.charlib.tool.service.PatchResult;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Applies a JSON edit document to a Liberty library.
 */
@Command(
        name = "patch",
        mixinStandardHelpOptions = true,
        description = "Applies the values of a JSON edit document to a Liberty library and writes the result."
)
public class PatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PatchCommand.class);

    @Mixin
    private PatchOptions options;

    private final CommandOptionsValidator validator = new CommandOptionsValidator();
    private final ResultsPrinter printer = new ResultsPrinter();
    private final LibertyPatchService service;

    public PatchCommand() {
        this(new LibertyPatchService());
    }

    public PatchCommand(LibertyPatchService service) {
        this.service = service;
    }

    @Override
    public Integer call() {
        PatchConfig config;
        try {
            config = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error("Invalid {} options:", e.getCommand());
            e.getErrors().forEach(error -> log.error("  - {}", error));
            return CommandLine.ExitCode.USAGE;
        }

        printer.printBanner(config);
        PatchResult result = service.patch(config);
        if (!result.isSuccess()) {
            printer.printFailure("Patch", result.getErrorMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }

        printer.printSuccess(result);
        return CommandLine.ExitCode.OK;
    }
}
