package com.ocit.compiler.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A phase transition (Phasenuebergang) with its switching information.
 */
@Value
@Builder(toBuilder = true)
public class TransitionRecord {

    @NonNull
    String id;

    /**
     * Declared switching duration in seconds.
     */
    int duration;

    /**
     * Source phase ID, null when the document declares none.
     */
    String fromPhase;

    /**
     * Target phase ID, null when the document declares none.
     */
    String toPhase;

    @NonNull
    @Singular
    List<SwitchingElementRecord> elements;
}
