package com.ocit.compiler.transition;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ocit.compiler.model.StateTimeline;
import com.ocit.compiler.model.StateVector;
import com.ocit.compiler.model.TransitionKey;
import com.ocit.compiler.model.core.context.CompileDiagnostics;
import com.ocit.compiler.state.SignalStateTables;

import lombok.NoArgsConstructor;

/**
 * Keeps minor and major green consistent across a transition: an index that
 * starts with minor green and does not end with major green never shows major
 * green in between.
 */
@NoArgsConstructor
public class GreenConsistencyCorrector {

    private static final Logger log = LoggerFactory.getLogger(GreenConsistencyCorrector.class);

    public StateTimeline correct(TransitionKey key, StateTimeline timeline, StateVector fromState,
            StateVector toState, CompileDiagnostics diagnostics) {
        StateTimeline.Builder builder = timeline.toBuilder();
        boolean changed = false;
        for (int index = 0; index < fromState.length(); index++) {
            if (fromState.letterAt(index) != SignalStateTables.MINOR_GREEN
                    || toState.letterAt(index) == SignalStateTables.MAJOR_GREEN) {
                continue;
            }
            List<Integer> corrected = new ArrayList<>();
            for (int t = 0; t < builder.length(); t++) {
                if (builder.letter(t, index) == SignalStateTables.MAJOR_GREEN) {
                    builder.set(t, index, SignalStateTables.MINOR_GREEN);
                    corrected.add(t);
                }
            }
            if (!corrected.isEmpty()) {
                changed = true;
                String message = String.format("corrected inconsistent state in transition '%s' index %d times %s",
                        key.getTransitionId(), index, corrected);
                log.warn(message);
                diagnostics.addWarning(message);
            }
        }
        return changed ? builder.build() : timeline;
    }
}
