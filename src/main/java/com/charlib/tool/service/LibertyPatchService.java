package com.charlib.tool.service;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.codec.InterchangeCodec;
import com.charlib.tool.config.PatchConfig;
import com.charlib.tool.diagnostics.PatchDiagnostics;
import com.charlib.tool.exception.LibertyToolException;
import com.charlib.tool.model.LibrarySnapshot;
import com.charlib.tool.parser.TextTreeEngine;
import com.charlib.tool.patch.PatchEngine;
import com.charlib.tool.tree.LibertyGroup;
import com.charlib.tool.tree.LibertyTree;
import com.charlib.tool.tree.TreeEngine;

/**
 * Patch entry point: applies an edit document to a Liberty source and writes the result.
 *
 * The destination is written once, after the whole traversal; a failed run leaves it untouched.
 */
public class LibertyPatchService {
    private static final Logger log = LoggerFactory.getLogger(LibertyPatchService.class);

    private final TreeEngine treeEngine;
    private final PatchEngine patchEngine;
    private final InterchangeCodec codec;

    public LibertyPatchService() {
        this(new TextTreeEngine(), new PatchEngine(), new InterchangeCodec());
    }

    public LibertyPatchService(TreeEngine treeEngine, PatchEngine patchEngine, InterchangeCodec codec) {
        this.treeEngine = treeEngine;
        this.patchEngine = patchEngine;
        this.codec = codec;
    }

    public PatchResult patch(PatchConfig config) {
        LibrarySnapshot edits;
        try {
            edits = codec.decode(config.getEdits());
        } catch (IOException e) {
            return PatchResult.failure("Failed to read edit document " + config.getEdits() + ": " + e.getMessage());
        } catch (LibertyToolException e) {
            return PatchResult.failure("Invalid edit document " + config.getEdits() + ": " + e.getMessage());
        }
        return patch(config.getSource(), edits, config.getOutput());
    }

    public PatchResult patch(Path source, LibrarySnapshot edits, Path destination) {
        try (LibertyTree tree = treeEngine.open(source)) {
            LibertyGroup library = tree.getFirstTopGroup().orElse(null);
            if (library == null) {
                return PatchResult.failure("No library group found in " + source);
            }
            log.info("Patching library {} with {} cells", library.getFirstName().orElse("<unnamed>"),
                    edits.getCells().size());

            PatchDiagnostics diagnostics = patchEngine.apply(library, edits);
            tree.write(library, destination);

            return PatchResult.builder()
                    .success(true)
                    .outputPath(destination)
                    .diagnostics(diagnostics)
                    .build();
        } catch (LibertyToolException e) {
            log.debug("Patch of {} failed", source, e);
            return PatchResult.failure(e.getMessage());
        }
    }
}
