package com.ocit.compiler.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ocit.compiler.CompilationResult;
import com.ocit.compiler.model.CompiledPhaseProgram;
import com.ocit.compiler.model.CompiledSignalProgram;
import com.ocit.compiler.model.UnitFailure;
import com.ocit.compiler.model.core.context.CompilationStats;
import com.ocit.compiler.model.core.context.CompilerConfig;
import com.ocit.compiler.model.input.OcitDocument;

/**
 * Responsible only for logging the run banner and the run summary.
 * No validation, no compilation.
 */
public class CompileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CompileResultsPrinter.class);

    public void printBanner(CompilerConfig config, OcitDocument document) {
        log.info("=================================================");
        log.info("OCIT Phase Compiler");
        log.info("=================================================");
        log.info("TLS ID: {}", config.getTlsId());
        log.info("Mode: {}", config.isUsePrograms() ? "signal programs" : "phase list");
        log.info("Signal Groups: {}", document.getSignalGroups().size());
        log.info("Phases: {}", document.getPhases().size());
        log.info("Transitions: {}", document.getTransitions().size());
        log.info("Programs: {}", document.getPrograms().size());

        if (!config.getMinorIndices().isEmpty()) {
            log.info("Minor Indices: {}", config.getMinorIndices());
        }
        if (!config.getMajorGroups().isEmpty()) {
            log.info("Major Groups: {}", config.getMajorGroups());
        }
        if (!config.getIgnorePhases().isEmpty() || !config.getIgnoreNodes().isEmpty()) {
            log.info("Ignored Phases: {}  Ignored Nodes: {}", config.getIgnorePhases(), config.getIgnoreNodes());
        }
        if (config.isUsePrograms()) {
            log.info("Grouping: {}", config.isGrouping());
        } else {
            log.info("Min Duration: {}  Phase Duration: {}", config.getMinDuration(), config.getPhaseDuration());
        }
        if (config.getTrace().isActive()) {
            log.info("Trace: index={} group={} transition={}", config.getTrace().getIndex(),
                    config.getTrace().getGroup(), config.getTrace().getTransition());
        }
        log.info("=================================================");
    }

    public void printSuccess(CompilationResult result) {
        log.info("");
        log.info("=================================================");
        log.info("COMPILATION SUCCESSFUL");
        log.info("=================================================");
        printUnits(result);
        printStats(result.getStats());
        log.info("=================================================");
    }

    public void printFailure(CompilationResult result) {
        log.error("Compilation failed: {}", result.getErrorMessage());
        for (UnitFailure failure : result.getFailures()) {
            log.error("  {}: {}", failure.getUnitId(), failure.getReason());
        }
        if (!result.getPhasePrograms().isEmpty() || !result.getSignalPrograms().isEmpty()) {
            log.info("Units compiled despite failures:");
            printUnits(result);
        }
    }

    private void printUnits(CompilationResult result) {
        for (CompiledPhaseProgram program : result.getPhasePrograms()) {
            log.info("  {}: {} phases, {} entries, {} transitions", program.getTlsId(), program.getCycle().size(),
                    program.size(), program.getTransitionCount());
        }
        for (CompiledSignalProgram program : result.getSignalPrograms()) {
            log.info("  {} program {}: cycle {}s, {} steps", program.getTlsId(), program.getProgramId(),
                    program.getCycleTime(), program.getSteps().size());
        }
        if (result.getDiagnostics().hasWarnings()) {
            log.info("Warnings: {}", result.getDiagnostics().getWarnings().size());
        }
    }

    private void printStats(CompilationStats stats) {
        if (stats == null) {
            return;
        }
        log.info("");
        log.info("Cycles Compiled: {}", stats.getCyclesCompiled());
        log.info("Cycles Skipped: {}", stats.getCyclesSkipped());
        log.info("Programs Compiled: {}", stats.getProgramsCompiled());
        log.info("Transitions Compiled: {}", stats.getTransitionsCompiled());
        log.info("Phase Entries: {}", stats.getPhaseEntries());
        log.info("Compile Time: {} ms", stats.getCompileTimeMillis());
    }
}
