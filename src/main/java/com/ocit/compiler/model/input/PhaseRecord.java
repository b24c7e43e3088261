package com.ocit.compiler.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A phase definition: the steady signal picture of every listed group.
 */
@Value
@Builder(toBuilder = true)
public class PhaseRecord {

    @NonNull
    String id;

    @NonNull
    @Singular
    List<PhaseElementRecord> elements;
}
