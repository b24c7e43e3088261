package com.ocit.compiler.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Continuous-program compilation result: one signal program over a fixed cycle.
 */
@Value
@Builder(toBuilder = true)
public class CompiledSignalProgram {

    @NonNull
    String tlsId;

    @NonNull
    String programId;

    int cycleTime;

    @NonNull
    @Singular
    List<TimedState> steps;

    public int totalDuration() {
        return steps.stream().mapToInt(TimedState::getDuration).sum();
    }
}
