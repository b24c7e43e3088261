package com.ocit.compiler.state;

import static com.ocit.compiler.state.SignalStateTables.COMPLEX_STATES;
import static com.ocit.compiler.state.SignalStateTables.MAJOR_GREEN;
import static com.ocit.compiler.state.SignalStateTables.MINOR_GREEN;
import static com.ocit.compiler.state.SignalStateTables.SIGNAL_COLORS;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.ocit.compiler.exception.UnknownSignalColorException;
import com.ocit.compiler.exception.UnresolvedComplexStateException;
import com.ocit.compiler.model.ComplexStateVector;
import com.ocit.compiler.model.ComplexTimeline;
import com.ocit.compiler.model.StateTimeline;
import com.ocit.compiler.model.StateVector;
import com.ocit.compiler.signalgroup.SignalGroupIndex;

import lombok.NoArgsConstructor;

/**
 * Interprets OCIT pictures and complex states as SUMO letters.
 *
 * {@link #normalize} is the single place where complex states become SUMO
 * state strings, for phases, transitions and signal programs alike.
 */
@NoArgsConstructor
public class StateInterpreter {

    public char translateColor(String color) {
        Character letter = SIGNAL_COLORS.get(color);
        if (letter == null) {
            throw new UnknownSignalColorException(color);
        }
        return letter;
    }

    /**
     * Reduces the letters of all groups at one link index to one SUMO letter.
     *
     * @throws UnresolvedComplexStateException when the combination is not in
     *         {@link SignalStateTables#COMPLEX_STATES}
     */
    public char interpretComplexState(String complexState) {
        if (complexState.isEmpty()) {
            throw new UnresolvedComplexStateException(complexState);
        }
        char first = complexState.charAt(0);
        if (complexState.chars().allMatch(c -> c == first)) {
            return first;
        }
        Character single = COMPLEX_STATES.get(complexState);
        if (single == null) {
            throw new UnresolvedComplexStateException(complexState);
        }
        return single;
    }

    /**
     * Same as {@link #interpretComplexState(String)}, with the phase/transition and
     * link index named in the failure message.
     */
    public char interpretComplexState(String complexState, String context, int index, SignalGroupIndex groups) {
        try {
            return interpretComplexState(complexState);
        } catch (UnresolvedComplexStateException e) {
            throw new UnresolvedComplexStateException(complexState,
                    "index " + index + " in '" + context + "', groups " + groups.groupsAt(index));
        }
    }

    /**
     * Turns a complex state vector into a SUMO state string.
     *
     * An index driven by a group from {@code majorGroups} is forced to major green.
     * Otherwise the complex state is reduced, and a major green at an index from
     * {@code minorIndices} is demoted to minor green.
     */
    public StateVector normalize(ComplexStateVector states, String context, SignalGroupIndex groups,
            Set<String> majorGroups, Set<Integer> minorIndices) {
        char[] letters = new char[states.size()];
        for (int i = 0; i < letters.length; i++) {
            if (groups.groupsAt(i).stream().anyMatch(majorGroups::contains)) {
                letters[i] = MAJOR_GREEN;
                continue;
            }
            char letter = interpretComplexState(states.complexState(i), context, i, groups);
            if (letter == MAJOR_GREEN && minorIndices.contains(i)) {
                letter = MINOR_GREEN;
            }
            letters[i] = letter;
        }
        return StateVector.of(letters);
    }

    public StateTimeline normalize(ComplexTimeline timeline, String context, SignalGroupIndex groups,
            Set<String> majorGroups, Set<Integer> minorIndices) {
        List<StateVector> ticks = new ArrayList<>(timeline.ticks());
        for (int t = 0; t < timeline.ticks(); t++) {
            ticks.add(normalize(timeline.tick(t), context, groups, majorGroups, minorIndices));
        }
        return StateTimeline.of(ticks);
    }
}
