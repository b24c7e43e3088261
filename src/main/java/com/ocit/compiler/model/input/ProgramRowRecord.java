package com.ocit.compiler.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One row (SPZeile) of a signal program. A row either switches at discrete
 * times or shows one permanent color for the whole cycle.
 */
@Value
@Builder(toBuilder = true)
public class ProgramRowRecord {

    @NonNull
    String groupId;

    @NonNull
    @Singular
    List<SwitchTimeRecord> switchTimes;

    /**
     * Permanent picture (DauerSignalbild), only consulted when there are no switch times.
     */
    String permanentColor;
}
