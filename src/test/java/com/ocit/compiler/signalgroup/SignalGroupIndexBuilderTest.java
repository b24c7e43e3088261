package com.ocit.compiler.signalgroup;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.ocit.compiler.model.core.context.CompileDiagnostics;
import com.ocit.compiler.model.input.SignalGroupRecord;
import com.ocit.compiler.model.input.TransitionElementRecord;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SignalGroupIndexBuilder and the resulting SignalGroupIndex.
 */
class SignalGroupIndexBuilderTest {

    private CompileDiagnostics diagnostics;
    private SignalGroupIndex index;

    @BeforeEach
    void setUp() {
        diagnostics = new CompileDiagnostics();
        List<SignalGroupRecord> records = List.of(
                SignalGroupRecord.builder().id("K1").comment("0")
                        .activation(TransitionElementRecord.ofDuration(1))
                        .deactivation(TransitionElementRecord.ofDuration(3))
                        .build(),
                SignalGroupRecord.builder().id("K2").comment("1;2").subNode(2)
                        .activation(TransitionElementRecord.ofDuration(1))
                        .deactivation(TransitionElementRecord.ofDuration(2))
                        .build(),
                SignalGroupRecord.builder().id("K2L").comment("2").build(),
                SignalGroupRecord.builder().id("BL1").comment("3")
                        .deactivation(TransitionElementRecord.ofDuration(5))
                        .build(),
                SignalGroupRecord.builder().id("X9").build(),
                SignalGroupRecord.builder().id("Y1").comment("a;b").build());
        index = new SignalGroupIndexBuilder().build(records, 1, diagnostics);
    }

    @Test
    void testGroupIndices() {
        assertThat(index.indicesOf("K2")).containsExactly(1, 2);
        assertThat(index.indicesOf("unknown")).isEmpty();
        assertThat(index.getMaxIndex()).isEqualTo(3);
        assertThat(index.width()).isEqualTo(4);
    }

    @Test
    void testGroupsSharingAnIndexAreOrderedByPriority() {
        // directional arrows come before regular heads
        assertThat(index.groupsAt(2)).containsExactly("K2L", "K2");
        assertThat(index.slotOf(2, "K2L")).isZero();
        assertThat(index.slotOf(2, "K2")).isEqualTo(1);
        assertThat(index.slotCounts()).containsExactly(1, 1, 2, 1);
    }

    @Test
    void testSlotOfUnrelatedGroupFails() {
        assertThatThrownBy(() -> index.slotOf(0, "K2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("K2");
    }

    @Test
    void testRecordsWithoutUsableCommentAreSkipped() {
        assertThat(index.contains("X9")).isFalse();
        assertThat(index.contains("Y1")).isFalse();
        assertThat(diagnostics.getSkippedRecords())
                .extracting(RecordValidation::getRecordId)
                .containsExactly("X9", "Y1");
        assertThat(diagnostics.getWarnings()).hasSize(2);
        assertThat(diagnostics.getWarnings().get(0)).isEqualTo("Signal group 'X9' skipped: no link index comment");
    }

    @Test
    void testNegativeIndexIsRejected() {
        RecordValidation validation = new SignalGroupIndexBuilder()
                .validate(SignalGroupRecord.builder().id("K7").comment("4;-1").build());

        assertThat(validation.isSkipped()).isTrue();
        assertThat(validation.getReason()).contains("negative link index -1");
    }

    @Test
    void testClearanceDurationsByIndex() {
        ClearanceDurations clearance = index.getClearance();

        assertThat(clearance.yellow(0)).isEqualTo(3);
        assertThat(clearance.yellow(1)).isEqualTo(2);
        assertThat(clearance.yellow(2)).isEqualTo(2);
        assertThat(clearance.redYellow(2)).isEqualTo(1);
        // blinkers carry no clearance times
        assertThat(clearance.yellow(3)).isZero();
        assertThat(clearance.yellowOfGroup("BL1")).isZero();
    }

    @Test
    void testGroupNeverInheritsClearanceOfSharedIndex() {
        ClearanceDurations clearance = index.getClearance();

        assertThat(clearance.yellow(2, "K2")).isEqualTo(2);
        assertThat(clearance.yellow(2, "K2L")).isZero();
    }

    @Test
    void testNodeGroups() {
        assertThat(index.getNodeGroups()).containsOnlyKeys(1, 2);
        assertThat(index.getNodeGroups().get(1)).containsExactly("K1", "K2L", "BL1");
        assertThat(index.getNodeGroups().get(2)).containsExactly("K2");
        assertThat(index.groupsOfAllNodes()).containsExactly("K1", "K2L", "BL1", "K2");
    }

    @Test
    void testRestrictTo() {
        SignalGroupIndex restricted = index.restrictTo(List.of("K1", "K2"));

        assertThat(restricted.contains("K2L")).isFalse();
        assertThat(restricted.groupsAt(2)).containsExactly("K2");
        assertThat(restricted.getMaxIndex()).isEqualTo(2);
        assertThat(restricted.getClearance()).isSameAs(index.getClearance());
    }

    @Test
    void testLegend() {
        assertThat(index.legend()).containsExactly(
                " 0: K1",
                " 1: K2",
                " 2: K2 K2L",
                " 3: BL1");
    }

    @ParameterizedTest
    @CsvSource({
        "K1, 1",
        "FR3, 0",
        "K4L, 0",
        "BL2, 2",
        "Fge1, 2",
        "Fgn1, 2",
        "H1, 2"
    })
    void testPriority(String groupId, int expected) {
        assertThat(SignalGroups.priority(groupId)).isEqualTo(expected);
    }
}
