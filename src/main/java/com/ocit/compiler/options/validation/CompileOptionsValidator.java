package com.ocit.compiler.options.validation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.ocit.compiler.model.core.context.CompilerConfig;
import com.ocit.compiler.model.core.context.TraceSelector;
import com.ocit.compiler.options.exception.OptionsValidationException;
import com.ocit.compiler.options.model.CompileOptions;

/**
 * Validates the raw options bag and turns it into a {@link CompilerConfig}.
 * All problems are collected and reported together.
 */
public class CompileOptionsValidator {

    public CompilerConfig validate(CompileOptions o) {
        List<String> errors = new ArrayList<>();

        if (isBlank(o.getTlsId())) {
            errors.add("Traffic light ID is required (--tls-id).");
        }
        if (o.getMinDuration() < 1) {
            errors.add("Minimum phase duration must be >= 1. Got: " + o.getMinDuration());
        }
        if (o.getPhaseDuration() < 1) {
            errors.add("Phase duration must be >= 1. Got: " + o.getPhaseDuration());
        }
        if (o.getVerboseIndex() != null && o.getVerboseIndex() < 0) {
            errors.add("Verbose index must be >= 0. Got: " + o.getVerboseIndex());
        }

        Set<Integer> minorIndices = parseIntegers("--minor-index", o.getMinorIndices(), errors);
        Set<Integer> ignorePhases = parseIntegers("--ignore-phases", o.getIgnorePhases(), errors);
        Set<Integer> ignoreNodes = parseIntegers("--ignore-nodes", o.getIgnoreNodes(), errors);
        Set<String> majorGroups = parseNames(o.getMajorGroups());

        for (Integer index : minorIndices) {
            if (index < 0) {
                errors.add("Minor index must be >= 0. Got: " + index);
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        return CompilerConfig.builder()
                .tlsId(o.getTlsId().trim())
                .minDuration(o.getMinDuration())
                .phaseDuration(o.getPhaseDuration())
                .minorIndices(Set.copyOf(minorIndices))
                .majorGroups(Set.copyOf(majorGroups))
                .ignorePhases(Set.copyOf(ignorePhases))
                .ignoreNodes(Set.copyOf(ignoreNodes))
                .grouping(!o.isNoGrouping())
                .usePrograms(o.isUsePrograms())
                .verbose(o.isVerbose())
                .trace(new TraceSelector(o.getVerboseIndex(), blankToNull(o.getVerboseGroup()),
                        blankToNull(o.getVerboseTransition())))
                .build();
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }

    private static List<String> split(String raw) {
        if (isBlank(raw)) {
            return List.of();
        }
        return Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    private static Set<Integer> parseIntegers(String option, String raw, List<String> errors) {
        Set<Integer> result = new LinkedHashSet<>();
        for (String value : split(raw)) {
            try {
                result.add(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                errors.add("Invalid integer '" + value + "' in " + option + ": " + raw);
            }
        }
        return result;
    }

    private static Set<String> parseNames(String raw) {
        return new LinkedHashSet<>(split(raw));
    }
}
