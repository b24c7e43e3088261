package com.ocit.compiler.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A run of {@code duration} consecutive ticks showing the same state.
 */
@Value
public class TimedState {
    int duration;
    @NonNull
    StateVector state;

    public static TimedState of(int duration, String letters) {
        return new TimedState(duration, StateVector.of(letters));
    }
}
