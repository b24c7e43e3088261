package com.ocit.compiler.phase;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ocit.compiler.model.ComplexStateVector;
import com.ocit.compiler.model.Cycle;
import com.ocit.compiler.model.input.PhaseElementRecord;
import com.ocit.compiler.model.input.PhaseRecord;
import com.ocit.compiler.signalgroup.SignalGroupIndex;
import com.ocit.compiler.state.SignalStateTables;
import com.ocit.compiler.state.StateInterpreter;

import lombok.RequiredArgsConstructor;

/**
 * Builds the steady complex state of every phase in a cycle.
 */
@RequiredArgsConstructor
public class PhaseStateBuilder {

    private static final Logger log = LoggerFactory.getLogger(PhaseStateBuilder.class);

    private final StateInterpreter interpreter;

    /**
     * @return phase ID -> complex state, in document order, for the phases of {@code cycle} only
     */
    public Map<String, ComplexStateVector> build(List<PhaseRecord> phases, Cycle cycle, SignalGroupIndex groups) {
        ComplexStateVector dark = ComplexStateVector.filled(groups.slotCounts(), SignalStateTables.DARK);
        Map<String, ComplexStateVector> result = new LinkedHashMap<>();

        for (PhaseRecord phase : phases) {
            if (!cycle.contains(phase.getId())) {
                continue;
            }
            ComplexStateVector state = dark;
            for (PhaseElementRecord element : phase.getElements()) {
                char letter = interpreter.translateColor(element.getColor());
                for (int index : groups.indicesOf(element.getGroupId())) {
                    state = state.withSlot(index, groups.slotOf(index, element.getGroupId()), letter);
                }
            }
            result.put(phase.getId(), state);
            log.debug("Phase {} -> {}", phase.getId(), state);
        }
        return result;
    }
}
