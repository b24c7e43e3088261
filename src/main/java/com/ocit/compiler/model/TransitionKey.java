package com.ocit.compiler.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class TransitionKey {
    @NonNull
    String transitionId;
    @NonNull
    String fromPhase;
    @NonNull
    String toPhase;

    public boolean connects(String from, String to) {
        return fromPhase.equals(from) && toPhase.equals(to);
    }
}
