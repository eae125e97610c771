package com.charlib.tool.model;

import java.util.List;

/**
 * Process corner of a characterization run and its integer encoding in {@link Pvt#getProcess()}.
 */
public enum ProcessCorner {
    SS(List.of(1)),
    TT(List.of(2)),
    FF(List.of(3)),
    UNKNOWN(List.of());

    private final List<Integer> encoding;

    ProcessCorner(List<Integer> encoding) {
        this.encoding = encoding;
    }

    public List<Integer> getEncoding() {
        return encoding;
    }

    /**
     * Maps an exact corner name ({@code "SS"}, {@code "TT"} or {@code "FF"}) to its corner;
     * anything else, including other spellings, is {@link #UNKNOWN}.
     */
    public static ProcessCorner fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return switch (name) {
            case "SS" -> SS;
            case "TT" -> TT;
            case "FF" -> FF;
            default -> UNKNOWN;
        };
    }
}
