package com.ocit.compiler.timeline;

import java.util.ArrayList;
import java.util.List;

import com.ocit.compiler.model.StateTimeline;
import com.ocit.compiler.model.StateVector;
import com.ocit.compiler.model.TimedState;

import lombok.NoArgsConstructor;

/**
 * Run-length encoding of per-tick state sequences.
 */
@NoArgsConstructor
public class TimelineCompactor {

    /**
     * Collapses consecutive equal states into one {@link TimedState} each.
     */
    public List<TimedState> compact(List<StateVector> ticks) {
        List<TimedState> runs = new ArrayList<>();
        StateVector current = null;
        int length = 0;
        for (StateVector tick : ticks) {
            if (tick.equals(current)) {
                length++;
                continue;
            }
            if (current != null) {
                runs.add(new TimedState(length, current));
            }
            current = tick;
            length = 1;
        }
        if (current != null) {
            runs.add(new TimedState(length, current));
        }
        return runs;
    }

    public List<TimedState> compact(StateTimeline timeline) {
        return compact(timeline.ticks());
    }

    /**
     * One {@link TimedState} of duration 1 per tick.
     */
    public List<TimedState> perTick(List<StateVector> ticks) {
        return ticks.stream().map(tick -> new TimedState(1, tick)).toList();
    }

    /**
     * Inverse of {@link #compact(List)}.
     */
    public List<StateVector> expand(List<TimedState> runs) {
        List<StateVector> ticks = new ArrayList<>();
        for (TimedState run : runs) {
            for (int i = 0; i < run.getDuration(); i++) {
                ticks.add(run.getState());
            }
        }
        return ticks;
    }
}
