package com.ocit.compiler.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A fixed-time signal program (Signalprogramm).
 */
@Value
@Builder(toBuilder = true)
public class ProgramRecord {

    @NonNull
    String id;

    /**
     * Cycle time (TU) in seconds.
     */
    int cycleTime;

    @NonNull
    @Singular
    List<ProgramRowRecord> rows;
}
