package com.ocit.compiler.transition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ocit.compiler.model.ComplexStateVector;
import com.ocit.compiler.model.ComplexTimeline;
import com.ocit.compiler.model.TransitionKey;
import com.ocit.compiler.model.core.context.TraceSelector;
import com.ocit.compiler.model.input.SwitchTimeRecord;
import com.ocit.compiler.model.input.SwitchingElementRecord;
import com.ocit.compiler.model.input.TransitionRecord;
import com.ocit.compiler.signalgroup.SignalGroupIndex;
import com.ocit.compiler.signalgroup.SignalGroups;
import com.ocit.compiler.state.SignalStateTables;
import com.ocit.compiler.state.StateInterpreter;

import lombok.RequiredArgsConstructor;

/**
 * Expands authored phase transitions into per-second complex state timelines.
 *
 * Every tick starts as the reduced state of the from-phase. Each switching
 * element then writes its start picture into all ticks of its group and
 * overwrites the tail of the timeline at each of its switching times.
 */
@RequiredArgsConstructor
public class TransitionSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(TransitionSynthesizer.class);

    private final StateInterpreter interpreter;

    /**
     * @return complex timelines in document order; transitions without both a
     *         known from-phase and a known to-phase are dropped
     */
    public Map<TransitionKey, ComplexTimeline> synthesize(List<TransitionRecord> transitions,
            Map<String, ComplexStateVector> phases, SignalGroupIndex groups, TraceSelector trace) {
        Map<TransitionKey, ComplexTimeline> result = new LinkedHashMap<>();
        for (TransitionRecord transition : transitions) {
            String fromPhase = transition.getFromPhase();
            String toPhase = transition.getToPhase();
            if (fromPhase == null || !phases.containsKey(fromPhase) || toPhase == null
                    || !phases.containsKey(toPhase)) {
                log.debug("Transition {} ({} -> {}) does not connect two phases of this cycle",
                        transition.getId(), fromPhase, toPhase);
                continue;
            }
            TransitionKey key = new TransitionKey(transition.getId(), fromPhase, toPhase);
            result.put(key, synthesize(transition, phases.get(fromPhase), groups, trace));
        }
        return result;
    }

    ComplexTimeline synthesize(TransitionRecord transition, ComplexStateVector fromState, SignalGroupIndex groups,
            TraceSelector trace) {
        String id = transition.getId();
        int duration = Math.max(1, transition.getDuration());
        ComplexStateVector initialState = reduceInitialState(id, fromState, groups, trace);
        ComplexTimeline.Cells cells = ComplexTimeline.replicate(initialState, duration).toCells();

        for (SwitchingElementRecord element : transition.getElements()) {
            String groupId = element.getGroupId();
            List<Integer> indices = groups.indicesOf(groupId);
            if (indices.isEmpty()) {
                log.debug("Transition {}: signal group {} drives no link index", id, groupId);
                continue;
            }

            char initial = element.getInitialColor() != null
                    ? interpreter.translateColor(element.getInitialColor())
                    : fromState.slot(indices.get(0), 0);
            if (trace.matches(id, groupId, null)) {
                log.info("{} {} init {} ({}) indices {}", id, groupId, initial, element.getInitialColor(), indices);
            }
            for (int index : indices) {
                cells.fillFrom(0, index, groups.slotOf(index, groupId), initial);
            }

            for (SwitchTimeRecord switchTime : element.getSwitchTimes()) {
                char letter = interpreter.translateColor(switchTime.getColor());
                if (trace.matches(id, groupId, null)) {
                    log.info("{} {} t={} {} ({}) indices {}", id, groupId, switchTime.getTime(), letter,
                            switchTime.getColor(), indices);
                }
                for (int index : indices) {
                    cells.fillFrom(switchTime.getTime(), index, groups.slotOf(index, groupId), letter);
                }
            }
        }

        ComplexTimeline timeline = cells.build();
        if (trace.matches(id, null, null)) {
            log.info("{}", id);
            for (int t = 0; t < timeline.ticks(); t++) {
                log.info("{}", timeline.tick(t));
            }
        }
        return timeline;
    }

    /**
     * Start state of a transition. Non-blinker slots keep their letter, except a
     * major green that the index as a whole reduces to minor green becomes minor
     * green. Blinker slots are copied unchanged.
     */
    public ComplexStateVector reduceInitialState(String transitionId, ComplexStateVector fromState,
            SignalGroupIndex groups, TraceSelector trace) {
        String[] reduced = new String[fromState.size()];
        for (int index = 0; index < fromState.size(); index++) {
            String complexState = fromState.complexState(index);
            List<String> indexGroups = groups.groupsAt(index);
            StringBuilder sb = new StringBuilder();
            for (int slot = 0; slot < indexGroups.size(); slot++) {
                char groupState = complexState.charAt(slot);
                if (SignalGroups.isBlinker(indexGroups.get(slot))) {
                    sb.append(groupState);
                    continue;
                }
                char single = interpreter.interpretComplexState(complexState, transitionId, index, groups);
                if (groupState == SignalStateTables.MAJOR_GREEN && single == SignalStateTables.MINOR_GREEN) {
                    sb.append(single);
                } else {
                    sb.append(groupState);
                }
            }
            if (sb.length() == 0) {
                sb.append(SignalStateTables.DARK);
            }
            reduced[index] = sb.toString();
            if (trace.matches(transitionId, null, index)) {
                log.info("{} i={} default {}", transitionId, index, reduced[index]);
            }
        }
        return ComplexStateVector.of(reduced);
    }
}
