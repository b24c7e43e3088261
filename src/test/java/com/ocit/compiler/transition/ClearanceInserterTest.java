package com.ocit.compiler.transition;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.ocit.compiler.model.StateTimeline;
import com.ocit.compiler.model.StateVector;
import com.ocit.compiler.model.TransitionKey;
import com.ocit.compiler.model.core.context.CompileDiagnostics;
import com.ocit.compiler.model.input.SignalGroupRecord;
import com.ocit.compiler.model.input.TransitionElementRecord;
import com.ocit.compiler.signalgroup.ClearanceDurations;
import com.ocit.compiler.signalgroup.SignalGroupIndexBuilder;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ClearanceInserter yellow and red-yellow insertion.
 */
class ClearanceInserterTest {

    private static final TransitionKey KEY = new TransitionKey("PU12", "Phase 1", "Phase 2");

    private final ClearanceInserter inserter = new ClearanceInserter();

    @Test
    void testRedYellowBeforeGreen() {
        StateTimeline result = insert("r", "G", durations(0, 1), "r", "r", "G", "G");

        assertThat(result.column(0)).isEqualTo("rruG");
    }

    @Test
    void testYellowAfterGreen() {
        StateTimeline result = insert("G", "r", durations(3, 0), "G", "r", "r", "r", "r");

        assertThat(result.column(0)).isEqualTo("Gyyyr");
    }

    @Test
    void testYellowFollowsMinorGreenOfFromPhase() {
        StateTimeline result = insert("g", "r", durations(2, 0), "r", "r", "r");

        assertThat(result.column(0)).isEqualTo("yyr");
    }

    @Test
    void testYellowStopsAtTransitionEnd() {
        StateTimeline result = insert("G", "r", durations(5, 0), "r", "r");

        assertThat(result.column(0)).isEqualTo("yy");
    }

    @Test
    void testOnlyFirstGreenToRedSwitchGetsYellow() {
        StateTimeline result = insert("G", "r", durations(1, 0), "r", "G", "r");

        assertThat(result.column(0)).isEqualTo("yGr");
    }

    @Test
    void testFromPhaseRedBeforeImmediateGreen() {
        StateTimeline result = insert("r", "G", durations(0, 1), "G", "G");

        assertThat(result.column(0)).isEqualTo("uG");
    }

    @Test
    void testRedYellowNeverWritesPastTransitionEnd() {
        StateTimeline result = insert("G", "G", durations(0, 1), "r", "r");

        assertThat(result.column(0)).isEqualTo("rr");
    }

    @Test
    void testRedYellowOtherThanOneTickIsNotInserted() {
        StateTimeline result = insert("r", "G", durations(0, 2), "r", "r", "G", "G");

        assertThat(result.column(0)).isEqualTo("rrGG");
    }

    @Test
    void testIndicesAreIndependent() {
        ClearanceDurations durations = clearance(group("K1", "0", 0, 2), group("K2", "1", 1, 0));
        StateTimeline timeline = StateTimeline.of("Gr", "rr", "rG", "rG");

        StateTimeline result = inserter.insert(KEY, timeline, StateVector.of("Gr"), StateVector.of("rG"), durations,
                true);

        assertThat(result.column(0)).isEqualTo("Gyyr");
        // last red before the green is tick 1, so red-yellow lands on tick 2
        assertThat(result.column(1)).isEqualTo("rruG");
    }

    private StateTimeline insert(String from, String to, ClearanceDurations durations, String... ticks) {
        return inserter.insert(KEY, StateTimeline.of(ticks), StateVector.of(from), StateVector.of(to), durations,
                false);
    }

    private static ClearanceDurations durations(int yellow, int redYellow) {
        return clearance(group("K1", "0", redYellow, yellow));
    }

    private static SignalGroupRecord group(String id, String comment, int redYellow, int yellow) {
        return SignalGroupRecord.builder()
                .id(id)
                .comment(comment)
                .activation(TransitionElementRecord.ofDuration(redYellow))
                .deactivation(TransitionElementRecord.ofDuration(yellow))
                .build();
    }

    private static ClearanceDurations clearance(SignalGroupRecord... records) {
        return new SignalGroupIndexBuilder().build(List.of(records), 1, new CompileDiagnostics()).getClearance();
    }
}
