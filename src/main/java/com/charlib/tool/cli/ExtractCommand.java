package com.charlib.tool.cli;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.cli.exception.OptionsValidationException;
import com.charlib.tool.cli.model.ExtractOptions;
import com.charlib.tool.cli.output.ResultsPrinter;
import com.charlib.tool.cli.validation.CommandOptionsValidator;
import com.charlib.tool.config.ExtractConfig;
import com.charlib.tool.service.ExtractionResult;
import com.charlib.tool.service.LibertyExtractionService;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Extracts cells, pins, arcs and leakage of a Liberty library into a JSON document.
 */
@Command(
        name = "extract",
        mixinStandardHelpOptions = true,
        description = "Extracts timing and power data from a Liberty library into a JSON document."
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Mixin
    private ExtractOptions options;

    @Spec
    private CommandSpec spec;

    private final CommandOptionsValidator validator = new CommandOptionsValidator();
    private final ResultsPrinter printer = new ResultsPrinter();
    private final LibertyExtractionService service;

    public ExtractCommand() {
        this(new LibertyExtractionService());
    }

    public ExtractCommand(LibertyExtractionService service) {
        this.service = service;
    }

    @Override
    public Integer call() {
        ExtractConfig config;
        try {
            config = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error("Invalid {} options:", e.getCommand());
            e.getErrors().forEach(error -> log.error("  - {}", error));
            return CommandLine.ExitCode.USAGE;
        }

        printer.printBanner(config);
        ExtractionResult result = service.extract(config);
        if (!result.isSuccess()) {
            printer.printFailure("Extraction", result.getErrorMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }

        if (config.getOutput() == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.println(result.getDocument());
            out.flush();
        }
        printer.printSuccess(result);
        return CommandLine.ExitCode.OK;
    }
}
