package com.ocit.compiler.model.input;

import lombok.NonNull;
import lombok.Value;

/**
 * A single switching point: from {@code time} on, the group shows {@code color}.
 */
@Value
public class SwitchTimeRecord {
    int time;
    @NonNull
    String color;
}
