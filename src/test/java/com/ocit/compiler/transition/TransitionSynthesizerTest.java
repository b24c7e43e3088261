package com.ocit.compiler.transition;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ocit.compiler.model.ComplexStateVector;
import com.ocit.compiler.model.ComplexTimeline;
import com.ocit.compiler.model.TransitionKey;
import com.ocit.compiler.model.core.context.CompileDiagnostics;
import com.ocit.compiler.model.core.context.TraceSelector;
import com.ocit.compiler.model.input.SignalGroupRecord;
import com.ocit.compiler.model.input.SwitchTimeRecord;
import com.ocit.compiler.model.input.SwitchingElementRecord;
import com.ocit.compiler.model.input.TransitionRecord;
import com.ocit.compiler.signalgroup.SignalGroupIndex;
import com.ocit.compiler.signalgroup.SignalGroupIndexBuilder;
import com.ocit.compiler.state.StateInterpreter;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TransitionSynthesizer.
 */
class TransitionSynthesizerTest {

    private final TransitionSynthesizer synthesizer = new TransitionSynthesizer(new StateInterpreter());

    private final SignalGroupIndex groups = new SignalGroupIndexBuilder().build(List.of(
            SignalGroupRecord.builder().id("K1").comment("0").build(),
            SignalGroupRecord.builder().id("BL1").comment("0").build(),
            SignalGroupRecord.builder().id("K2").comment("1").build()), 1, new CompileDiagnostics());

    private final Map<String, ComplexStateVector> phases = Map.of(
            "Phase 1", ComplexStateVector.of("rO", "G"),
            "Phase 2", ComplexStateVector.of("GO", "r"));

    @Test
    void testSwitchTimesOverwriteTail() {
        TransitionRecord transition = transition("PU12", 4,
                SwitchingElementRecord.builder().groupId("K1").switchTime(new SwitchTimeRecord(2, "gruen")).build());

        ComplexTimeline timeline = synthesizer.synthesize(transition, phases.get("Phase 1"), groups,
                TraceSelector.none());

        assertThat(timeline.ticks()).isEqualTo(4);
        assertThat(column(timeline, 0, 0)).isEqualTo("rrGG");
        // groups without switching elements keep the from-phase picture
        assertThat(column(timeline, 1, 0)).isEqualTo("GGGG");
        assertThat(column(timeline, 0, 1)).isEqualTo("OOOO");
    }

    @Test
    void testLaterSwitchWins() {
        TransitionRecord transition = transition("PU12", 5,
                SwitchingElementRecord.builder().groupId("K1")
                        .switchTime(new SwitchTimeRecord(1, "gruen"))
                        .switchTime(new SwitchTimeRecord(3, "gelb"))
                        .build());

        ComplexTimeline timeline = synthesizer.synthesize(transition, phases.get("Phase 1"), groups,
                TraceSelector.none());

        assertThat(column(timeline, 0, 0)).isEqualTo("rGGyy");
    }

    @Test
    void testExplicitInitialColor() {
        TransitionRecord transition = transition("PU12", 3,
                SwitchingElementRecord.builder().groupId("K2").initialColor("gelb").build());

        ComplexTimeline timeline = synthesizer.synthesize(transition, phases.get("Phase 1"), groups,
                TraceSelector.none());

        assertThat(column(timeline, 1, 0)).isEqualTo("yyy");
    }

    @Test
    void testSwitchBeyondDurationIsIgnored() {
        TransitionRecord transition = transition("PU12", 2,
                SwitchingElementRecord.builder().groupId("K2").switchTime(new SwitchTimeRecord(7, "rot")).build());

        ComplexTimeline timeline = synthesizer.synthesize(transition, phases.get("Phase 1"), groups,
                TraceSelector.none());

        assertThat(column(timeline, 1, 0)).isEqualTo("GG");
    }

    @Test
    void testDurationIsAtLeastOneTick() {
        ComplexTimeline timeline = synthesizer.synthesize(transition("PU12", 0), phases.get("Phase 1"), groups,
                TraceSelector.none());

        assertThat(timeline.ticks()).isEqualTo(1);
    }

    @Test
    void testTransitionsOutsideTheCycleAreDropped() {
        List<TransitionRecord> transitions = List.of(
                transition("PU12", 3),
                TransitionRecord.builder().id("PU13").duration(3).fromPhase("Phase 1").toPhase("Phase 3").build(),
                TransitionRecord.builder().id("PUX").duration(3).toPhase("Phase 1").build());

        Map<TransitionKey, ComplexTimeline> result = synthesizer.synthesize(transitions, phases, groups,
                new TraceSelector(null, null, "PU"));

        assertThat(result.keySet()).containsExactly(new TransitionKey("PU12", "Phase 1", "Phase 2"));
    }

    @Test
    void testInitialStateDemotesGreenReducedToMinor() {
        ComplexStateVector reduced = synthesizer.reduceInitialState("PU", ComplexStateVector.of("Go", "G"), groups,
                TraceSelector.none());

        // blinker slot copied unchanged
        assertThat(reduced.asList()).containsExactly("go", "G");
    }

    @Test
    void testInitialStateKeepsMajorGreen() {
        ComplexStateVector reduced = synthesizer.reduceInitialState("PU", ComplexStateVector.of("GO", "r"), groups,
                TraceSelector.none());

        assertThat(reduced.asList()).containsExactly("GO", "r");
    }

    private static TransitionRecord transition(String id, int duration, SwitchingElementRecord... elements) {
        return TransitionRecord.builder()
                .id(id)
                .duration(duration)
                .fromPhase("Phase 1")
                .toPhase("Phase 2")
                .elements(List.of(elements))
                .build();
    }

    private static String column(ComplexTimeline timeline, int index, int slot) {
        StringBuilder sb = new StringBuilder();
        for (int t = 0; t < timeline.ticks(); t++) {
            sb.append(timeline.letter(t, index, slot));
        }
        return sb.toString();
    }
}
