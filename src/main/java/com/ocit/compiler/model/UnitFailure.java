package com.ocit.compiler.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A cycle or program whose compilation was aborted.
 */
@Value
public class UnitFailure {
    @NonNull
    String unitId;
    @NonNull
    String reason;
}
