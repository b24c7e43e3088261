package com.ocit.compiler.transition;

import static com.ocit.compiler.state.SignalStateTables.RED;
import static com.ocit.compiler.state.SignalStateTables.RED_YELLOW;
import static com.ocit.compiler.state.SignalStateTables.YELLOW;
import static com.ocit.compiler.state.SignalStateTables.isGreen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ocit.compiler.model.StateTimeline;
import com.ocit.compiler.model.StateVector;
import com.ocit.compiler.model.TransitionKey;
import com.ocit.compiler.signalgroup.ClearanceDurations;

import lombok.NoArgsConstructor;

/**
 * Adds yellow before green-to-red switches and red-yellow before red-to-green
 * switches inside a transition timeline.
 */
@NoArgsConstructor
public class ClearanceInserter {

    private static final Logger log = LoggerFactory.getLogger(ClearanceInserter.class);

    public StateTimeline insert(TransitionKey key, StateTimeline timeline, StateVector fromState, StateVector toState,
            ClearanceDurations durations, boolean verbose) {
        StateTimeline.Builder builder = timeline.toBuilder();
        for (int index = 0; index < toState.length(); index++) {
            insertYellow(builder, index, fromState.letterAt(index), durations.yellow(index));
            insertRedYellow(builder, index, fromState.letterAt(index), toState.letterAt(index),
                    durations.redYellow(index));
        }
        StateTimeline result = builder.build();

        if (verbose) {
            log.info("{}", key.getTransitionId());
            log.info("  {} (before)", fromState);
            for (int t = 0; t < result.length(); t++) {
                log.info("{} {}", t, result.tick(t));
            }
            log.info("  {} (after)", toState);
        }
        return result;
    }

    /**
     * First green-to-red switch: the red tick and the following ticks become
     * yellow, up to the yellow duration and never past the transition end.
     */
    private void insertYellow(StateTimeline.Builder builder, int index, char fromLetter, int yellowDuration) {
        char before = fromLetter;
        for (int t = 0; t < builder.length(); t++) {
            char current = builder.letter(t, index);
            if (current == RED && isGreen(before)) {
                int end = Math.min(builder.length(), t + yellowDuration);
                for (int t2 = t; t2 < end; t2++) {
                    builder.set(t2, index, YELLOW);
                }
                return;
            }
            before = current;
        }
    }

    /**
     * Scanning backwards from the to-phase, the last red-to-green switch gets one
     * red-yellow tick after the red. The from-phase stands in for the tick before
     * the transition. Only a red-yellow time of exactly one tick is inserted.
     */
    private void insertRedYellow(StateTimeline.Builder builder, int index, char fromLetter, char toLetter,
            int redYellowDuration) {
        if (redYellowDuration != 1) {
            // TODO: insert longer red-yellow times once the required overlap with the preceding red is defined
            return;
        }
        char after = toLetter;
        for (int t = builder.length() - 1; t >= -1; t--) {
            char current = t == -1 ? fromLetter : builder.letter(t, index);
            if (current == RED && isGreen(after)) {
                if (t + 1 < builder.length()) {
                    builder.set(t + 1, index, RED_YELLOW);
                }
                return;
            }
            after = current;
        }
    }
}
