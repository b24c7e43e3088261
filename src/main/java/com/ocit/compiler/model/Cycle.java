package com.ocit.compiler.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Ordered phases of one controller node, compiled into one SUMO program.
 */
@Value
@Builder(toBuilder = true)
public class Cycle {

    /**
     * Phase IDs in cycle order.
     */
    @NonNull
    @Singular
    List<String> phaseIds;

    /**
     * Numeric tag of each phase, taken from the first digits of its ID ("Phase 12" -> 12).
     */
    @NonNull
    @Singular
    Map<String, Integer> majorTags;

    /**
     * Partial node number, null for single-node controllers.
     */
    Integer nodeIndex;

    public String getNodeId() {
        return nodeIndex == null ? "" : String.valueOf(nodeIndex);
    }

    public int majorTag(String phaseId) {
        Integer tag = majorTags.get(phaseId);
        return tag == null ? 0 : tag;
    }

    public String phaseAfter(int position) {
        return phaseIds.get((position + 1) % phaseIds.size());
    }

    public boolean contains(String phaseId) {
        return phaseIds.contains(phaseId);
    }
}
