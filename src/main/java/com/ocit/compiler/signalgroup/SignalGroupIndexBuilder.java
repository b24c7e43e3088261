package com.ocit.compiler.signalgroup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ocit.compiler.model.core.context.CompileDiagnostics;
import com.ocit.compiler.model.input.SignalGroupRecord;
import com.ocit.compiler.model.input.TransitionElementRecord;

import lombok.NoArgsConstructor;

/**
 * Builds the {@link SignalGroupIndex} from the document's signal groups.
 *
 * The SUMO link indices of a group are stored in its comment as a
 * semicolon-separated list ("4;5"). Groups without a usable comment are
 * skipped and reported in the diagnostics.
 */
@NoArgsConstructor
public class SignalGroupIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(SignalGroupIndexBuilder.class);

    static final String RECORD_TYPE = "Signal group";
    private static final String INDEX_SEPARATOR = ";";

    /**
     * @param defaultNode partial node of groups that do not declare their own
     */
    public SignalGroupIndex build(List<SignalGroupRecord> records, int defaultNode, CompileDiagnostics diagnostics) {
        Map<String, List<Integer>> groupIndices = new LinkedHashMap<>();
        Map<Integer, List<String>> nodeGroups = new TreeMap<>();
        ClearanceDurations clearance = new ClearanceDurations();

        for (SignalGroupRecord record : records) {
            RecordValidation validation = validate(record);
            if (validation.isSkipped()) {
                log.warn("{}", validation.describe());
                diagnostics.recordSkipped(validation);
                continue;
            }

            String id = record.getId();
            List<Integer> indices = parseIndices(record.getComment());
            groupIndices.put(id, indices);

            // blinkers have no clearance times
            if (!SignalGroups.isBlinker(id)) {
                Integer redYellow = durationOf(record.getActivation());
                if (redYellow != null) {
                    clearance.recordRedYellow(id, indices, redYellow);
                }
                Integer yellow = durationOf(record.getDeactivation());
                if (yellow != null) {
                    clearance.recordYellow(id, indices, yellow);
                }
            }

            int node = record.getSubNode() != null ? record.getSubNode() : defaultNode;
            nodeGroups.computeIfAbsent(node, n -> new ArrayList<>()).add(id);
            log.debug("Signal group {} -> indices {} (node {})", id, indices, node);
        }

        return new SignalGroupIndex(groupIndices, nodeGroups, clearance);
    }

    /**
     * Checks that a record carries a parsable, non-empty list of non-negative link indices.
     */
    public RecordValidation validate(SignalGroupRecord record) {
        String comment = record.getComment();
        if (comment == null || comment.isBlank()) {
            return RecordValidation.skipped(RECORD_TYPE, record.getId(), "no link index comment");
        }
        try {
            List<Integer> indices = parseIndices(comment);
            for (Integer index : indices) {
                if (index < 0) {
                    return RecordValidation.skipped(RECORD_TYPE, record.getId(),
                            "negative link index " + index + " in comment '" + comment + "'");
                }
            }
        } catch (NumberFormatException e) {
            return RecordValidation.skipped(RECORD_TYPE, record.getId(),
                    "comment '" + comment + "' is not a list of link indices");
        }
        return RecordValidation.accepted(RECORD_TYPE, record.getId());
    }

    static List<Integer> parseIndices(String comment) {
        List<Integer> indices = new ArrayList<>();
        for (String part : comment.split(INDEX_SEPARATOR, -1)) {
            indices.add(Integer.parseInt(part.trim()));
        }
        return indices;
    }

    private static Integer durationOf(TransitionElementRecord element) {
        return element == null ? null : element.getDuration();
    }
}
