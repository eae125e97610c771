package com.charlib.tool.model;

import java.util.List;
import java.util.Optional;

/**
 * A pin that carries timing and internal power arcs.
 */
public interface ArcOwner {

    String getPinName();

    List<TimingArc> getTimingArcs();

    List<PowerArc> getPowerArcs();

    /**
     * First arc with the given identity; later duplicates are never selected.
     */
    default Optional<TimingArc> findTimingArc(TimingArcKey key) {
        return getTimingArcs().stream().filter(arc -> arc.key().equals(key)).findFirst();
    }

    default Optional<PowerArc> findPowerArc(PowerArcKey key) {
        return getPowerArcs().stream().filter(arc -> arc.key().equals(key)).findFirst();
    }
}
