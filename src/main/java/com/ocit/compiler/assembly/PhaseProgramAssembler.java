package com.ocit.compiler.assembly;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.ocit.compiler.model.CompiledPhase;
import com.ocit.compiler.model.CompiledPhaseProgram;
import com.ocit.compiler.model.Cycle;
import com.ocit.compiler.model.StateVector;
import com.ocit.compiler.model.TimedState;
import com.ocit.compiler.model.TransitionKey;
import com.ocit.compiler.model.core.context.CompilerConfig;

import lombok.NoArgsConstructor;

/**
 * Stitches steady phases and compacted transitions into one SUMO phase list.
 *
 * Phases are emitted in cycle order, each followed by its transition to the
 * next cycle phase when one exists. Remaining transitions are appended after
 * the cycle. The last entry of a transition points back ({@code next}) to its
 * destination phase when that phase was already emitted.
 */
@NoArgsConstructor
public class PhaseProgramAssembler {

    private static final String ANNOTATION_FORMAT = "%3d %s";

    public CompiledPhaseProgram assemble(Cycle cycle, Map<String, StateVector> phases,
            Map<TransitionKey, List<TimedState>> timedTransitions, List<String> indexLegend, CompilerConfig config) {
        CompiledPhaseProgram.CompiledPhaseProgramBuilder program = CompiledPhaseProgram.builder()
                .tlsId(config.getTlsId() + cycle.getNodeId())
                .nodeId(cycle.getNodeId())
                .cycle(cycle.getPhaseIds())
                .indexLegend(indexLegend)
                .standardPhaseDuration(config.getPhaseDuration())
                .transitionCount(timedTransitions.size());

        Map<String, Integer> emitted = new HashMap<>();
        Set<TransitionKey> used = new HashSet<>();
        int position = 0;

        List<String> phaseIds = cycle.getPhaseIds();
        for (int i = 0; i < phaseIds.size(); i++) {
            String phaseId = phaseIds.get(i);
            program.phase(new CompiledPhase(config.getMinDuration(), phases.get(phaseId).letters(),
                    CompiledPhase.NO_NEXT, cycle.majorTag(phaseId), 0));
            program.annotation(String.format(ANNOTATION_FORMAT, position, phaseId));
            emitted.put(phaseId, position);
            position++;

            String nextPhase = cycle.phaseAfter(i);
            TransitionKey key = findTransition(timedTransitions, phaseId, nextPhase, used);
            if (key != null) {
                used.add(key);
                position = appendTransition(program, key, timedTransitions.get(key), emitted, cycle, position);
            }
        }

        for (Map.Entry<TransitionKey, List<TimedState>> entry : timedTransitions.entrySet()) {
            if (used.contains(entry.getKey())) {
                continue;
            }
            position = appendTransition(program, entry.getKey(), entry.getValue(), emitted, cycle, position);
        }
        return program.build();
    }

    private static TransitionKey findTransition(Map<TransitionKey, List<TimedState>> timedTransitions, String from,
            String to, Set<TransitionKey> used) {
        for (TransitionKey key : timedTransitions.keySet()) {
            if (key.connects(from, to) && !used.contains(key)) {
                return key;
            }
        }
        return null;
    }

    private static int appendTransition(CompiledPhaseProgram.CompiledPhaseProgramBuilder program, TransitionKey key,
            List<TimedState> runs, Map<String, Integer> emitted, Cycle cycle, int position) {
        for (int i = 0; i < runs.size(); i++) {
            TimedState run = runs.get(i);
            int next = i == runs.size() - 1
                    ? emitted.getOrDefault(key.getToPhase(), CompiledPhase.NO_NEXT)
                    : CompiledPhase.NO_NEXT;
            program.phase(new CompiledPhase(run.getDuration(), run.getState().letters(), next,
                    cycle.majorTag(key.getFromPhase()), cycle.majorTag(key.getToPhase())));
            program.annotation(String.format(ANNOTATION_FORMAT, position, key.getTransitionId()));
            position++;
        }
        return position;
    }
}
