package com.charlib.tool.patch;

import static com.charlib.tool.tree.LibertyNames.*;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.diagnostics.PatchDiagnostics;
import com.charlib.tool.exception.TreeMutationException;
import com.charlib.tool.model.Lut;
import com.charlib.tool.tree.AttributeType;
import com.charlib.tool.tree.LibertyAttribute;
import com.charlib.tool.tree.LibertyGroup;
import com.charlib.tool.util.LibertyNumberFormat;

/**
 * Replaces the {@code index_1}, {@code index_2} and {@code values} attributes of a LUT group.
 *
 * Existing attributes are always deleted. Each one is recreated only when the table
 * carries data for it, so an empty table leaves the group without data. {@code values}
 * gets one string value per row.
 */
class LutWriter {
    private static final Logger log = LoggerFactory.getLogger(LutWriter.class);

    private final PatchDiagnostics diagnostics;

    LutWriter(PatchDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Counts the LUT as rewritten only when every delete and create went through.
     */
    void rewrite(LibertyGroup lutGroup, Lut lut, String location) {
        boolean complete = deleteAll(lutGroup, INDEX_1, location);
        complete &= deleteAll(lutGroup, INDEX_2, location);
        complete &= deleteAll(lutGroup, VALUES, location);

        if (!lut.getIndex1().isEmpty()) {
            complete &= writeRows(lutGroup, INDEX_1, List.of(lut.getIndex1()), location);
        }
        if (!lut.getIndex2().isEmpty()) {
            complete &= writeRows(lutGroup, INDEX_2, List.of(lut.getIndex2()), location);
        }
        if (!lut.getValues().isEmpty()) {
            complete &= writeRows(lutGroup, VALUES, lut.getValues(), location);
        }
        if (complete) {
            diagnostics.lutRewritten();
            log.debug("Rewrote LUT {}", location);
        }
    }

    private boolean deleteAll(LibertyGroup group, String name, String location) {
        LibertyAttribute attribute = group.findAttribute(name).orElse(null);
        while (attribute != null) {
            try {
                group.deleteAttribute(attribute);
            } catch (TreeMutationException e) {
                fail(location, name, e);
                return false;
            }
            attribute = group.findAttribute(name).orElse(null);
        }
        return true;
    }

    private boolean writeRows(LibertyGroup group, String name, List<List<Double>> rows, String location) {
        try {
            LibertyAttribute attribute = group.createAttribute(name, AttributeType.COMPLEX);
            for (List<Double> row : rows) {
                attribute.addStringValue(LibertyNumberFormat.join(row));
            }
            diagnostics.attributeWritten();
            return true;
        } catch (TreeMutationException e) {
            fail(location, name, e);
            return false;
        }
    }

    private void fail(String location, String name, TreeMutationException e) {
        String message = "Failed to update " + location + "." + name + ": " + e.getMessage();
        log.warn(message);
        diagnostics.attributeFailed(message);
    }
}
