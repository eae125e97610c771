package com.charlib.tool.model;

import java.util.Optional;

/**
 * The two LUT slots of an internal power arc. In the tree they are the
 * {@code rise_power} and {@code fall_power} groups.
 */
public enum PowerLutSlot {
    CELL_RISE("cell_rise", "rise_power"),
    CELL_FALL("cell_fall", "fall_power");

    private final String documentKey;
    private final String groupType;

    PowerLutSlot(String documentKey, String groupType) {
        this.documentKey = documentKey;
        this.groupType = groupType;
    }

    public String getDocumentKey() {
        return documentKey;
    }

    public String getGroupType() {
        return groupType;
    }

    public static Optional<PowerLutSlot> fromGroupType(String groupType) {
        for (PowerLutSlot slot : values()) {
            if (slot.groupType.equals(groupType)) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }
}
