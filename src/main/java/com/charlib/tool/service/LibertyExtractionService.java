package com.charlib.tool.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.codec.InterchangeCodec;
import com.charlib.tool.config.ExtractConfig;
import com.charlib.tool.diagnostics.ToolDiagnostics;
import com.charlib.tool.exception.LibertyToolException;
import com.charlib.tool.extract.LibraryProjector;
import com.charlib.tool.model.LibrarySnapshot;
import com.charlib.tool.parser.TextTreeEngine;
import com.charlib.tool.tree.LibertyGroup;
import com.charlib.tool.tree.LibertyTree;
import com.charlib.tool.tree.TreeEngine;

/**
 * Extraction entry point: reads a Liberty source and produces its interchange document.
 *
 * Never throws for source or IO problems; those come back as a failed {@link ExtractionResult}.
 */
public class LibertyExtractionService {
    private static final Logger log = LoggerFactory.getLogger(LibertyExtractionService.class);

    private final TreeEngine treeEngine;
    private final LibraryProjector projector;
    private final InterchangeCodec codec;

    public LibertyExtractionService() {
        this(new TextTreeEngine(), new LibraryProjector(), new InterchangeCodec());
    }

    public LibertyExtractionService(TreeEngine treeEngine, LibraryProjector projector, InterchangeCodec codec) {
        this.treeEngine = treeEngine;
        this.projector = projector;
        this.codec = codec;
    }

    public ExtractionResult extract(ExtractConfig config) {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        LibrarySnapshot snapshot;
        try (LibertyTree tree = treeEngine.open(config.getSource())) {
            List<LibertyGroup> topGroups = tree.getTopGroups();
            if (topGroups.isEmpty()) {
                return ExtractionResult.failure("No library group found in " + config.getSource());
            }
            if (topGroups.size() > 1) {
                String message = "Only the first of " + topGroups.size() + " top-level groups was extracted";
                log.warn(message);
                diagnostics.warn(message);
            }
            LibertyGroup library = topGroups.get(0);
            log.info("Extracting library {} ({} corner)", library.getFirstName().orElse("<unnamed>"), config.getCorner());
            snapshot = projector.project(library, config.getCorner(), diagnostics);
        } catch (LibertyToolException e) {
            log.debug("Extraction of {} failed", config.getSource(), e);
            return ExtractionResult.failure(e.getMessage());
        }

        String document = codec.encode(snapshot, config.isPretty());
        Path output = config.getOutput();
        if (output != null) {
            try {
                codec.write(document, output);
            } catch (IOException e) {
                log.debug("Writing {} failed", output, e);
                return ExtractionResult.failure("Failed to write " + output + ": " + e.getMessage());
            }
        }

        return ExtractionResult.builder()
                .success(true)
                .snapshot(snapshot)
                .document(document)
                .outputPath(output)
                .cellsExtracted(snapshot.getCells().size())
                .timingArcsExtracted(snapshot.countTimingArcs())
                .powerArcsExtracted(snapshot.countPowerArcs())
                .warnings(diagnostics.getWarnings())
                .build();
    }
}
