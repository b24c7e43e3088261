package com.ocit.compiler.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Phase-list compilation result for one cycle (one partial node).
 *
 * {@code phases} and {@code annotations} are parallel lists.
 */
@Value
@Builder(toBuilder = true)
public class CompiledPhaseProgram {

    /**
     * Traffic light ID: configured controller ID plus the node ID.
     */
    @NonNull
    String tlsId;

    @NonNull
    String nodeId;

    @NonNull
    @Singular("cyclePhase")
    List<String> cycle;

    @NonNull
    @Singular
    List<CompiledPhase> phases;

    @NonNull
    @Singular
    List<String> annotations;

    /**
     * "index: groups" lines describing which signal groups drive each link index.
     */
    @NonNull
    @Singular("indexLegendLine")
    List<String> indexLegend;

    int standardPhaseDuration;

    int transitionCount;

    public int size() {
        return phases.size();
    }
}
