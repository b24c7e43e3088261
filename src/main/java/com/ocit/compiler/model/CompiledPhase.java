package com.ocit.compiler.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One entry of a compiled phase program.
 *
 * {@code nextIndex} is -1 unless this entry ends a transition back to a phase
 * that was already emitted. Steady phases carry {@code majorNext == 0}.
 */
@Value
public class CompiledPhase {
    public static final int NO_NEXT = -1;

    int duration;
    @NonNull
    String state;
    int nextIndex;
    int major;
    int majorNext;

    public boolean isSteady() {
        return majorNext == 0;
    }

    public boolean hasNext() {
        return nextIndex >= 0;
    }

    /**
     * Duration a writer should emit: steady phases run for the standard phase duration.
     */
    public int effectiveDuration(int standardPhaseDuration) {
        return isSteady() ? standardPhaseDuration : duration;
    }
}
