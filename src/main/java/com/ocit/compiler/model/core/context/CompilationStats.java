package com.ocit.compiler.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated statistics for a compiler run.
 */
@Value
@Builder(toBuilder = true)
public class CompilationStats {

    int cyclesCompiled;
    int cyclesSkipped;
    int programsCompiled;
    int transitionsCompiled;
    int phaseEntries;
    int failedUnits;

    long compileTimeMillis;
}
