package com.ocit.compiler.model.core.context;

import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Validated, immutable compiler configuration.
 *
 * Built by {@code CompileOptionsValidator} from the raw options bag; every set is already parsed.
 */
@Value
@Builder(toBuilder = true)
public class CompilerConfig {

    /**
     * Traffic light ID used in the SUMO network.
     */
    @NonNull
    @Builder.Default
    String tlsId = "TLS_ID";

    /**
     * Duration given to steady phases in the compiled tuples.
     */
    @Builder.Default
    int minDuration = 5;

    /**
     * Standard duration a writer uses for steady phases.
     */
    @Builder.Default
    int phaseDuration = 100;

    /**
     * Link indices that always get minor green.
     */
    @NonNull
    @Builder.Default
    Set<Integer> minorIndices = Set.of();

    /**
     * Signal groups whose link indices always get major green.
     */
    @NonNull
    @Builder.Default
    Set<String> majorGroups = Set.of();

    /**
     * Phase tags excluded from cycle building.
     */
    @NonNull
    @Builder.Default
    Set<Integer> ignorePhases = Set.of();

    /**
     * Partial nodes that are not compiled.
     */
    @NonNull
    @Builder.Default
    Set<Integer> ignoreNodes = Set.of();

    /**
     * When false, program mode emits one step of duration 1 per tick.
     */
    @Builder.Default
    boolean grouping = true;

    /**
     * Compile the document's signal programs instead of its phases and transitions.
     */
    boolean usePrograms;

    boolean verbose;

    @NonNull
    @Builder.Default
    TraceSelector trace = TraceSelector.none();
}
