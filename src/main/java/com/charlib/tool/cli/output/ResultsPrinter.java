package com.charlib.tool.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.config.ExtractConfig;
import com.charlib.tool.config.PatchConfig;
import com.charlib.tool.diagnostics.PatchDiagnostics;
import com.charlib.tool.service.ExtractionResult;
import com.charlib.tool.service.PatchResult;

/**
 * Responsible only for printing CLI summaries. No validation, no execution.
 */
public class ResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ResultsPrinter.class);

    public void printBanner(ExtractConfig config) {
        log.info("=================================================");
        log.info("Liberty Extract");
        log.info("=================================================");
        log.info("Source: {}", config.getSource().toAbsolutePath());
        log.info("Process Corner: {}", config.getCorner());
        log.info("Output: {}", config.getOutput() != null ? config.getOutput().toAbsolutePath() : "stdout");
        log.info("=================================================");
    }

    public void printBanner(PatchConfig config) {
        log.info("=================================================");
        log.info("Liberty Patch");
        log.info("=================================================");
        log.info("Source: {}", config.getSource().toAbsolutePath());
        log.info("Edits: {}", config.getEdits().toAbsolutePath());
        log.info("Output: {}", config.getOutput().toAbsolutePath());
        log.info("=================================================");
    }

    public void printSuccess(ExtractionResult result) {
        log.info("");
        log.info("=================================================");
        log.info("EXTRACTION SUCCESSFUL");
        log.info("=================================================");
        if (result.getOutputPath() != null) {
            log.info("Output Path: {}", result.getOutputPath().toAbsolutePath());
        }
        log.info("Cells: {}", result.getCellsExtracted());
        log.info("Timing Arcs: {}", result.getTimingArcsExtracted());
        log.info("Power Arcs: {}", result.getPowerArcsExtracted());
        printWarnings(result.getWarnings().size());
        log.info("=================================================");
    }

    public void printSuccess(PatchResult result) {
        PatchDiagnostics d = result.getDiagnostics();

        log.info("");
        log.info("=================================================");
        log.info("PATCH SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath().toAbsolutePath());
        log.info("Cells Matched: {}", d.getCellsMatched());
        log.info("Pins Matched: {}", d.getPinsMatched());
        log.info("Timing Arcs Matched: {}", d.getTimingArcsMatched());
        log.info("Power Arcs Matched: {}", d.getPowerArcsMatched());
        log.info("Leakages Matched: {}", d.getLeakagesMatched());
        log.info("LUTs Rewritten: {}", d.getLutsRewritten());
        log.info("Attributes Written: {}", d.getAttributesWritten());
        if (d.getAttributeFailures() > 0) {
            log.warn("Attribute Failures: {}", d.getAttributeFailures());
        }
        printWarnings(d.getWarnings().size());
        log.info("=================================================");
    }

    public void printFailure(String operation, String errorMessage) {
        log.error("{} failed: {}", operation, errorMessage);
    }

    private void printWarnings(int count) {
        if (count > 0) {
            log.info("Warnings: {} (see log above)", count);
        }
    }
}
