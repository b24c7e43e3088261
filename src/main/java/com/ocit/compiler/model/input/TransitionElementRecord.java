package com.ocit.compiler.model.input;

import lombok.Value;

/**
 * Transition element of a signal group activation or deactivation.
 * The duration is null when the document omits it.
 */
@Value
public class TransitionElementRecord {
    Integer duration;

    public static TransitionElementRecord ofDuration(int duration) {
        return new TransitionElementRecord(duration);
    }
}
