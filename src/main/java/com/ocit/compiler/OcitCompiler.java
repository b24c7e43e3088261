package com.ocit.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ocit.compiler.assembly.CyclePlanner;
import com.ocit.compiler.assembly.PhaseProgramAssembler;
import com.ocit.compiler.assembly.SignalProgramAssembler;
import com.ocit.compiler.exception.OcitCompilationException;
import com.ocit.compiler.model.CompiledPhaseProgram;
import com.ocit.compiler.model.CompiledSignalProgram;
import com.ocit.compiler.model.ComplexStateVector;
import com.ocit.compiler.model.ComplexTimeline;
import com.ocit.compiler.model.Cycle;
import com.ocit.compiler.model.StateTimeline;
import com.ocit.compiler.model.StateVector;
import com.ocit.compiler.model.TimedState;
import com.ocit.compiler.model.TransitionKey;
import com.ocit.compiler.model.UnitFailure;
import com.ocit.compiler.model.core.context.CompilationStats;
import com.ocit.compiler.model.core.context.CompileDiagnostics;
import com.ocit.compiler.model.core.context.CompilerConfig;
import com.ocit.compiler.model.input.OcitDocument;
import com.ocit.compiler.model.input.PhaseRecord;
import com.ocit.compiler.output.CompileResultsPrinter;
import com.ocit.compiler.phase.PhaseStateBuilder;
import com.ocit.compiler.signalgroup.SignalGroupIndex;
import com.ocit.compiler.signalgroup.SignalGroupIndexBuilder;
import com.ocit.compiler.state.StateInterpreter;
import com.ocit.compiler.timeline.TimelineCompactor;
import com.ocit.compiler.transition.ClearanceInserter;
import com.ocit.compiler.transition.GreenConsistencyCorrector;
import com.ocit.compiler.transition.TransitionSynthesizer;

/**
 * Compiles a parsed OCIT document into SUMO traffic light programs.
 *
 * In phase-list mode every cycle (partial node) becomes one phase program; in
 * program mode every OCIT signal program becomes one fixed-time program. A
 * cycle or program that cannot be compiled is reported and the others are
 * still compiled.
 */
public class OcitCompiler {
    private static final Logger log = LoggerFactory.getLogger(OcitCompiler.class);

    /**
     * Node assumed for signal groups without a partial node override.
     */
    private static final int DEFAULT_NODE = 1;

    private final CompilerConfig config;
    private final StateInterpreter interpreter;
    private final SignalGroupIndexBuilder indexBuilder;
    private final CyclePlanner cyclePlanner;
    private final PhaseStateBuilder phaseBuilder;
    private final TransitionSynthesizer synthesizer;
    private final GreenConsistencyCorrector corrector;
    private final ClearanceInserter clearanceInserter;
    private final TimelineCompactor compactor;
    private final PhaseProgramAssembler phaseAssembler;
    private final SignalProgramAssembler programAssembler;
    private final CompileResultsPrinter printer;

    public OcitCompiler(CompilerConfig config) {
        this.config = config;
        this.interpreter = new StateInterpreter();
        this.indexBuilder = new SignalGroupIndexBuilder();
        this.cyclePlanner = new CyclePlanner();
        this.phaseBuilder = new PhaseStateBuilder(interpreter);
        this.synthesizer = new TransitionSynthesizer(interpreter);
        this.corrector = new GreenConsistencyCorrector();
        this.clearanceInserter = new ClearanceInserter();
        this.compactor = new TimelineCompactor();
        this.phaseAssembler = new PhaseProgramAssembler();
        this.programAssembler = new SignalProgramAssembler(interpreter, compactor);
        this.printer = new CompileResultsPrinter();
    }

    public CompilationResult compile(OcitDocument document) {
        long started = System.currentTimeMillis();
        CompileDiagnostics diagnostics = new CompileDiagnostics();
        printer.printBanner(config, document);

        try {
            CompilationResult result = config.isUsePrograms()
                    ? compilePrograms(document, diagnostics)
                    : compilePhaseLists(document, diagnostics);
            result.setStats(result.getStats().toBuilder()
                    .compileTimeMillis(System.currentTimeMillis() - started)
                    .build());

            if (result.isSuccess()) {
                printer.printSuccess(result);
            } else {
                printer.printFailure(result);
            }
            return result;

        } catch (Exception e) {
            log.error("Compilation failed", e);
            CompilationResult result = CompilationResult.failure(e.getMessage(), diagnostics);
            printer.printFailure(result);
            return result;
        }
    }

    private CompilationResult compilePhaseLists(OcitDocument document, CompileDiagnostics diagnostics) {
        log.info("Step 1: Indexing signal groups...");
        SignalGroupIndex groups = indexBuilder.build(document.getSignalGroups(), DEFAULT_NODE, diagnostics);
        logIndex(groups);

        log.info("Step 2: Building cycles...");
        List<String> phaseIds = document.getPhases().stream().map(PhaseRecord::getId).toList();
        List<Cycle> cycles = cyclePlanner.buildCycles(phaseIds, config.getIgnorePhases(), diagnostics);

        log.info("Step 3: Compiling {} cycle(s)...", cycles.size());
        List<CompiledPhaseProgram> programs = new ArrayList<>();
        List<UnitFailure> failures = new ArrayList<>();
        int skipped = 0;
        int transitions = 0;
        for (Cycle cycle : cycles) {
            log.info("NodeID='{}' Cycle={}", cycle.getNodeId(), cycle.getPhaseIds());
            if (cycle.getNodeIndex() != null && config.getIgnoreNodes().contains(cycle.getNodeIndex())) {
                log.info("Skipping NodeID {}", cycle.getNodeIndex());
                diagnostics.addInfo("Skipped node " + cycle.getNodeIndex());
                skipped++;
                continue;
            }
            try {
                CompiledPhaseProgram program = compileCycle(document, cycle, groups, diagnostics);
                programs.add(program);
                transitions += program.getTransitionCount();
            } catch (OcitCompilationException e) {
                String unit = "node '" + cycle.getNodeId() + "' " + cycle.getPhaseIds();
                log.error("Failed to compile {}: {}", unit, e.getMessage());
                diagnostics.addError(unit + ": " + e.getMessage());
                failures.add(new UnitFailure(unit, e.getMessage()));
            }
        }

        return CompilationResult.builder()
                .success(failures.isEmpty())
                .errorMessage(failures.isEmpty() ? null : failures.size() + " cycle(s) failed to compile")
                .phasePrograms(programs)
                .failures(failures)
                .diagnostics(diagnostics)
                .stats(CompilationStats.builder()
                        .cyclesCompiled(programs.size())
                        .cyclesSkipped(skipped)
                        .transitionsCompiled(transitions)
                        .phaseEntries(programs.stream().mapToInt(CompiledPhaseProgram::size).sum())
                        .failedUnits(failures.size())
                        .build())
                .build();
    }

    CompiledPhaseProgram compileCycle(OcitDocument document, Cycle cycle, SignalGroupIndex groups,
            CompileDiagnostics diagnostics) {
        Map<String, ComplexStateVector> complexPhases = phaseBuilder.build(document.getPhases(), cycle, groups);
        if (config.isVerbose()) {
            for (String phaseId : cycle.getPhaseIds()) {
                log.info("{} {}", phaseId, complexPhases.get(phaseId));
            }
        }

        Map<TransitionKey, ComplexTimeline> complexTransitions = synthesizer.synthesize(document.getTransitions(),
                complexPhases, groups, config.getTrace());

        Map<String, StateVector> phases = new LinkedHashMap<>();
        complexPhases.forEach((phaseId, state) -> phases.put(phaseId,
                interpreter.normalize(state, phaseId, groups, config.getMajorGroups(), config.getMinorIndices())));

        Map<TransitionKey, List<TimedState>> timedTransitions = new LinkedHashMap<>();
        for (Map.Entry<TransitionKey, ComplexTimeline> entry : complexTransitions.entrySet()) {
            TransitionKey key = entry.getKey();
            StateVector from = phases.get(key.getFromPhase());
            StateVector to = phases.get(key.getToPhase());

            StateTimeline timeline = interpreter.normalize(entry.getValue(), key.getTransitionId(), groups,
                    config.getMajorGroups(), config.getMinorIndices());
            timeline = corrector.correct(key, timeline, from, to, diagnostics);
            timeline = clearanceInserter.insert(key, timeline, from, to, groups.getClearance(), config.isVerbose());
            timedTransitions.put(key, compactor.compact(timeline));
        }

        return phaseAssembler.assemble(cycle, phases, timedTransitions, groups.legend(), config);
    }

    private CompilationResult compilePrograms(OcitDocument document, CompileDiagnostics diagnostics) {
        log.info("Step 1: Indexing signal groups...");
        SignalGroupIndex allGroups = indexBuilder.build(document.getSignalGroups(), DEFAULT_NODE, diagnostics);
        SignalGroupIndex groups = allGroups.restrictTo(allGroups.groupsOfAllNodes());
        logIndex(groups);

        log.info("Step 2: Compiling {} signal program(s)...", document.getPrograms().size());
        List<CompiledSignalProgram> programs = new ArrayList<>();
        List<UnitFailure> failures = new ArrayList<>();
        document.getPrograms().forEach(program -> {
            try {
                programs.add(programAssembler.assemble(program, groups, config));
            } catch (OcitCompilationException e) {
                String unit = "program '" + program.getId() + "'";
                log.error("Failed to compile {}: {}", unit, e.getMessage());
                diagnostics.addError(unit + ": " + e.getMessage());
                failures.add(new UnitFailure(unit, e.getMessage()));
            }
        });

        return CompilationResult.builder()
                .success(failures.isEmpty())
                .errorMessage(failures.isEmpty() ? null : failures.size() + " program(s) failed to compile")
                .signalPrograms(programs)
                .failures(failures)
                .diagnostics(diagnostics)
                .stats(CompilationStats.builder()
                        .programsCompiled(programs.size())
                        .phaseEntries(programs.stream().mapToInt(p -> p.getSteps().size()).sum())
                        .failedUnits(failures.size())
                        .build())
                .build();
    }

    private void logIndex(SignalGroupIndex groups) {
        if (!config.isVerbose()) {
            return;
        }
        log.info("group -> indices");
        groups.getGroupIndices().keySet().stream().sorted()
                .forEach(group -> log.info("{} {}", group, groups.indicesOf(group)));
        log.info("index -> groups");
        groups.getIndexGroups().forEach((index, members) -> log.info("{} {}", index, members));
    }
}
