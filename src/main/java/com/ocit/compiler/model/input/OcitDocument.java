package com.ocit.compiler.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Already-parsed content of one OCIT supply document.
 *
 * Produced by the XML reader; the compiler never sees markup. All lists keep document order.
 */
@Value
@Builder(toBuilder = true)
public class OcitDocument {

    @NonNull
    @Singular
    List<SignalGroupRecord> signalGroups;

    @NonNull
    @Singular
    List<PhaseRecord> phases;

    @NonNull
    @Singular
    List<TransitionRecord> transitions;

    @NonNull
    @Singular
    List<ProgramRecord> programs;
}
