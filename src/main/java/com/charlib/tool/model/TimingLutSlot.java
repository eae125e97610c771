package com.charlib.tool.model;

import java.util.Optional;

/**
 * The six LUT slots of a timing arc. The tree group type and the document key coincide.
 */
public enum TimingLutSlot {
    CELL_RISE("cell_rise"),
    RISE_TRANSITION("rise_transition"),
    CELL_FALL("cell_fall"),
    FALL_TRANSITION("fall_transition"),
    RISE_CONSTRAINT("rise_constraint"),
    FALL_CONSTRAINT("fall_constraint");

    private final String key;

    TimingLutSlot(String key) {
        this.key = key;
    }

    public String getDocumentKey() {
        return key;
    }

    public String getGroupType() {
        return key;
    }

    public static Optional<TimingLutSlot> fromGroupType(String groupType) {
        for (TimingLutSlot slot : values()) {
            if (slot.key.equals(groupType)) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }
}
