package com.ocit.compiler.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Switching element (PUeElement) of one signal group inside a transition.
 */
@Value
@Builder(toBuilder = true)
public class SwitchingElementRecord {

    @NonNull
    String groupId;

    /**
     * Explicit start color (StartSignalbild), null when the from-phase picture applies.
     */
    String initialColor;

    @NonNull
    @Singular
    List<SwitchTimeRecord> switchTimes;
}
