package com.ocit.compiler.model.input;

import lombok.NonNull;
import lombok.Value;

@Value
public class PhaseElementRecord {
    @NonNull
    String groupId;
    @NonNull
    String color;
}
