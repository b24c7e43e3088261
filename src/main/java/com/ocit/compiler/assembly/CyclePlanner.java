package com.ocit.compiler.assembly;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ocit.compiler.model.Cycle;
import com.ocit.compiler.model.core.context.CompileDiagnostics;

import lombok.NoArgsConstructor;

/**
 * Splits the document's phases into cycles, one per partial node.
 *
 * The major tag of a phase is the first number in its ID. Phases are taken in
 * tag order (ties by ID); every tag ending in 1 (1, 11, 21, ...) opens a new
 * cycle, so node 2 owns phases 21 to 29.
 */
@NoArgsConstructor
public class CyclePlanner {

    private static final Logger log = LoggerFactory.getLogger(CyclePlanner.class);

    private static final Pattern NUMBER = Pattern.compile("(\\d+)");

    public List<Cycle> buildCycles(List<String> phaseIds, Set<Integer> ignorePhases, CompileDiagnostics diagnostics) {
        Map<String, Integer> tags = new LinkedHashMap<>();
        for (String phaseId : phaseIds) {
            Integer tag = majorTag(phaseId);
            if (tag == null) {
                String message = "Phase '" + phaseId + "' has no numeric tag and is not part of any cycle";
                log.warn(message);
                diagnostics.addWarning(message);
                continue;
            }
            tags.put(phaseId, tag);
        }

        List<String> ordered = tags.keySet().stream()
                .sorted(Comparator.comparing((String id) -> tags.get(id)).thenComparing(Comparator.naturalOrder()))
                .toList();

        List<Cycle> cycles = new ArrayList<>();
        Cycle.CycleBuilder current = null;
        int currentSize = 0;
        for (String phaseId : ordered) {
            int tag = tags.get(phaseId);
            if (ignorePhases.contains(tag)) {
                log.debug("Ignoring phase {} (tag {})", phaseId, tag);
                continue;
            }
            if (tag % 10 == 1 && currentSize > 0) {
                cycles.add(current.build());
                current = null;
                currentSize = 0;
            }
            if (current == null) {
                current = Cycle.builder().nodeIndex(tag > 10 ? tag / 10 : null);
            }
            current.phaseId(phaseId).majorTag(phaseId, tag);
            currentSize++;
        }
        if (currentSize > 0) {
            cycles.add(current.build());
        }
        return cycles;
    }

    /**
     * First run of digits in a phase ID ("Phase 12" -> 12), null when there is none.
     */
    public static Integer majorTag(String phaseId) {
        Matcher matcher = NUMBER.matcher(phaseId);
        if (!matcher.find()) {
            return null;
        }
        return Integer.valueOf(matcher.group(1));
    }
}
