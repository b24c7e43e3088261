package com.ocit.compiler.options.validation;

import org.junit.jupiter.api.Test;

import com.ocit.compiler.model.core.context.CompilerConfig;
import com.ocit.compiler.options.exception.OptionsValidationException;
import com.ocit.compiler.options.model.CompileOptions;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CompileOptionsValidator.
 */
class CompileOptionsValidatorTest {

    private final CompileOptionsValidator validator = new CompileOptionsValidator();

    @Test
    void testDefaults() {
        CompilerConfig config = validator.validate(CompileOptions.builder().build());

        assertThat(config.getTlsId()).isEqualTo("TLS_ID");
        assertThat(config.getMinDuration()).isEqualTo(5);
        assertThat(config.getPhaseDuration()).isEqualTo(100);
        assertThat(config.getMinorIndices()).isEmpty();
        assertThat(config.getMajorGroups()).isEmpty();
        assertThat(config.isGrouping()).isTrue();
        assertThat(config.isUsePrograms()).isFalse();
        assertThat(config.getTrace().isActive()).isFalse();
    }

    @Test
    void testListsAreParsed() {
        CompilerConfig config = validator.validate(CompileOptions.builder()
                .tlsId(" J42 ")
                .minorIndices("3, 5,7")
                .majorGroups("K1,FR2")
                .ignorePhases("4")
                .ignoreNodes("2,3")
                .noGrouping(true)
                .usePrograms(true)
                .build());

        assertThat(config.getTlsId()).isEqualTo("J42");
        assertThat(config.getMinorIndices()).containsExactlyInAnyOrder(3, 5, 7);
        assertThat(config.getMajorGroups()).containsExactlyInAnyOrder("K1", "FR2");
        assertThat(config.getIgnorePhases()).containsExactly(4);
        assertThat(config.getIgnoreNodes()).containsExactlyInAnyOrder(2, 3);
        assertThat(config.isGrouping()).isFalse();
        assertThat(config.isUsePrograms()).isTrue();
    }

    @Test
    void testTraceSelector() {
        CompilerConfig config = validator.validate(CompileOptions.builder()
                .verboseIndex(4)
                .verboseGroup(" ")
                .verboseTransition("PU12")
                .build());

        assertThat(config.getTrace().getIndex()).isEqualTo(4);
        assertThat(config.getTrace().getGroup()).isNull();
        assertThat(config.getTrace().getTransition()).isEqualTo("PU12");
    }

    @Test
    void testAllErrorsAreCollected() {
        CompileOptions options = CompileOptions.builder()
                .tlsId("")
                .minDuration(0)
                .phaseDuration(-1)
                .minorIndices("1,x")
                .build();

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors()).containsExactly(
                        "Traffic light ID is required (--tls-id).",
                        "Minimum phase duration must be >= 1. Got: 0",
                        "Phase duration must be >= 1. Got: -1",
                        "Invalid integer 'x' in --minor-index: 1,x"));
    }

    @Test
    void testNegativeValuesAreRejected() {
        CompileOptions options = CompileOptions.builder()
                .minorIndices("-2")
                .verboseIndex(-1)
                .build();

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors()).containsExactly(
                        "Verbose index must be >= 0. Got: -1",
                        "Minor index must be >= 0. Got: -2"));
    }
}
