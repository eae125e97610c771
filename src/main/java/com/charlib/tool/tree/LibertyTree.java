package com.charlib.tool.tree;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * One open session over a parsed Liberty source.
 *
 * Sessions are not thread-safe and must be closed; use try-with-resources.
 */
public interface LibertyTree extends AutoCloseable {

    Path getSource();

    List<LibertyGroup> getTopGroups();

    default Optional<LibertyGroup> getFirstTopGroup() {
        List<LibertyGroup> groups = getTopGroups();
        return groups.isEmpty() ? Optional.empty() : Optional.of(groups.get(0));
    }

    /**
     * Serializes {@code group} to {@code destination}. The destination only appears
     * once the complete text has been produced.
     */
    void write(LibertyGroup group, Path destination);

    @Override
    void close();
}
