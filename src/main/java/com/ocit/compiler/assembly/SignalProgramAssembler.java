package com.ocit.compiler.assembly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ocit.compiler.exception.MalformedProgramRowException;
import com.ocit.compiler.exception.OcitCompilationException;
import com.ocit.compiler.model.CompiledSignalProgram;
import com.ocit.compiler.model.ComplexStateVector;
import com.ocit.compiler.model.StateVector;
import com.ocit.compiler.model.TimedState;
import com.ocit.compiler.model.core.context.CompilerConfig;
import com.ocit.compiler.model.input.ProgramRecord;
import com.ocit.compiler.model.input.ProgramRowRecord;
import com.ocit.compiler.model.input.SwitchTimeRecord;
import com.ocit.compiler.signalgroup.ClearanceDurations;
import com.ocit.compiler.signalgroup.SignalGroupIndex;
import com.ocit.compiler.state.SignalStateTables;
import com.ocit.compiler.state.StateInterpreter;
import com.ocit.compiler.timeline.TimelineCompactor;

import lombok.RequiredArgsConstructor;

/**
 * Compiles a fixed-time signal program directly into SUMO states, one per
 * second of the cycle, without going through phases.
 *
 * A row's switching times alternate the group between green and its closed
 * picture. Red-yellow is laid before each switch to green and yellow after each
 * switch away from green; both wrap around the cycle end.
 */
@RequiredArgsConstructor
public class SignalProgramAssembler {

    private static final Logger log = LoggerFactory.getLogger(SignalProgramAssembler.class);

    private final StateInterpreter interpreter;
    private final TimelineCompactor compactor;

    public CompiledSignalProgram assemble(ProgramRecord program, SignalGroupIndex groups, CompilerConfig config) {
        int cycleTime = program.getCycleTime();
        if (cycleTime < 1) {
            throw new OcitCompilationException("Program " + program.getId() + " has no positive cycle time");
        }
        String[][] cells = new String[cycleTime][groups.width()];
        for (String[] tick : cells) {
            Arrays.fill(tick, "");
        }

        for (ProgramRowRecord row : program.getRows()) {
            if (!groups.contains(row.getGroupId())) {
                log.debug("Program {}: skipping unknown signal group {}", program.getId(), row.getGroupId());
                continue;
            }
            applyRow(program.getId(), row, groups, cells, cycleTime);
        }

        List<StateVector> ticks = new ArrayList<>(cycleTime);
        for (String[] tick : cells) {
            String[] complexStates = new String[tick.length];
            for (int i = 0; i < tick.length; i++) {
                complexStates[i] = tick[i].isEmpty() ? String.valueOf(SignalStateTables.OFF_BLINKING) : tick[i];
            }
            ticks.add(interpreter.normalize(ComplexStateVector.of(complexStates), program.getId(), groups,
                    config.getMajorGroups(), config.getMinorIndices()));
        }

        List<TimedState> steps = config.isGrouping() ? compactor.compact(ticks) : compactor.perTick(ticks);
        if (config.isVerbose()) {
            log.info("Created program {}", program.getId());
            steps.forEach(step -> log.info("({}, {})", step.getDuration(), step.getState()));
        }
        return CompiledSignalProgram.builder()
                .tlsId(config.getTlsId())
                .programId(program.getId())
                .cycleTime(cycleTime)
                .steps(steps)
                .build();
    }

    private void applyRow(String programId, ProgramRowRecord row, SignalGroupIndex groups, String[][] cells,
            int cycleTime) {
        String groupId = row.getGroupId();
        List<Integer> indices = groups.indicesOf(groupId);

        if (row.getSwitchTimes().isEmpty()) {
            if (row.getPermanentColor() == null) {
                throw new MalformedProgramRowException(programId, groupId);
            }
            char permanent = interpreter.translateColor(row.getPermanentColor());
            for (int index : indices) {
                for (int t = 0; t < cycleTime; t++) {
                    cells[t][index] += permanent;
                }
            }
            return;
        }

        List<Character> states = new ArrayList<>();
        char closed = SignalStateTables.RED;
        for (SwitchTimeRecord switchTime : row.getSwitchTimes()) {
            char state = interpreter.translateColor(switchTime.getColor());
            states.add(state);
            if (state != SignalStateTables.MAJOR_GREEN) {
                closed = state;
            }
        }

        ClearanceDurations clearance = groups.getClearance();
        int start = 0;
        for (int k = 0; k < states.size(); k++) {
            int time = row.getSwitchTimes().get(k).getTime();
            char state = states.get(k);
            boolean onset = state == SignalStateTables.MAJOR_GREEN;
            char previous = onset ? closed : SignalStateTables.MAJOR_GREEN;
            int clearanceDuration = 0;

            for (int index : indices) {
                for (int t = Math.max(0, start); t < Math.min(time, cycleTime); t++) {
                    cells[t][index] += previous;
                }
                if (onset) {
                    clearanceDuration = clearance.redYellow(index, groupId);
                    for (int t = time - clearanceDuration; t < time; t++) {
                        cells[Math.floorMod(t, cycleTime)][index] = String.valueOf(SignalStateTables.RED_YELLOW);
                    }
                } else {
                    clearanceDuration = clearance.yellow(index, groupId);
                    for (int t = time; t < time + clearanceDuration; t++) {
                        cells[Math.floorMod(t, cycleTime)][index] = String.valueOf(SignalStateTables.YELLOW);
                    }
                }
            }

            start = onset ? time : time + clearanceDuration;
            if (k == states.size() - 1) {
                for (int index : indices) {
                    for (int t = Math.max(0, start); t < cycleTime; t++) {
                        cells[t][index] += state;
                    }
                }
            }
        }
    }
}
