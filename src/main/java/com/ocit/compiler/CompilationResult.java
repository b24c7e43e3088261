package com.ocit.compiler;

import java.util.ArrayList;
import java.util.List;

import com.ocit.compiler.model.CompiledPhaseProgram;
import com.ocit.compiler.model.CompiledSignalProgram;
import com.ocit.compiler.model.UnitFailure;
import com.ocit.compiler.model.core.context.CompilationStats;
import com.ocit.compiler.model.core.context.CompileDiagnostics;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one compiler run.
 */
@Data
@Builder
public class CompilationResult {
    private boolean success;
    private String errorMessage;

    @Builder.Default
    private List<CompiledPhaseProgram> phasePrograms = new ArrayList<>();

    @Builder.Default
    private List<CompiledSignalProgram> signalPrograms = new ArrayList<>();

    @Builder.Default
    private List<UnitFailure> failures = new ArrayList<>();

    @Builder.Default
    private CompileDiagnostics diagnostics = new CompileDiagnostics();

    private CompilationStats stats;

    public static CompilationResult failure(String errorMessage, CompileDiagnostics diagnostics) {
        return CompilationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .diagnostics(diagnostics)
                .build();
    }
}
