package com.ocit.compiler.signalgroup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.Getter;

/**
 * Mapping between signal groups and SUMO link indices.
 *
 * <ul>
 * <li>group -> link indices, in document order</li>
 * <li>index -> groups sharing the index, ordered by {@link SignalGroups#priority}</li>
 * </ul>
 * The position of a group in an index's group list is its slot in every complex state.
 */
@Getter
public class SignalGroupIndex {

    private final Map<String, List<Integer>> groupIndices;
    private final Map<Integer, List<String>> indexGroups;
    private final Map<Integer, List<String>> nodeGroups;
    private final ClearanceDurations clearance;
    private final int maxIndex;

    SignalGroupIndex(Map<String, List<Integer>> groupIndices, Map<Integer, List<String>> nodeGroups,
            ClearanceDurations clearance) {
        this.groupIndices = new LinkedHashMap<>(groupIndices);
        this.nodeGroups = new TreeMap<>(nodeGroups);
        this.clearance = clearance;
        this.indexGroups = buildIndexGroups(groupIndices);
        this.maxIndex = groupIndices.values().stream()
                .flatMap(List::stream)
                .mapToInt(Integer::intValue)
                .max()
                .orElse(-1);
    }

    private static Map<Integer, List<String>> buildIndexGroups(Map<String, List<Integer>> groupIndices) {
        Map<Integer, List<String>> result = new TreeMap<>();
        groupIndices.keySet().stream()
                .sorted(Comparator.comparingInt(SignalGroups::priority))
                .forEach(group -> {
                    for (Integer index : groupIndices.get(group)) {
                        result.computeIfAbsent(index, i -> new ArrayList<>()).add(group);
                    }
                });
        return result;
    }

    /**
     * Number of link indices in every state vector.
     */
    public int width() {
        return maxIndex + 1;
    }

    public boolean contains(String groupId) {
        return groupIndices.containsKey(groupId);
    }

    public List<Integer> indicesOf(String groupId) {
        return groupIndices.getOrDefault(groupId, List.of());
    }

    public List<String> groupsAt(int index) {
        return indexGroups.getOrDefault(index, List.of());
    }

    /**
     * Slot of {@code groupId} within the complex state of {@code index}.
     */
    public int slotOf(int index, String groupId) {
        int slot = groupsAt(index).indexOf(groupId);
        if (slot < 0) {
            throw new IllegalArgumentException("Signal group " + groupId + " does not drive link index " + index);
        }
        return slot;
    }

    /**
     * Slots per index; an index driven by no group still has one slot.
     */
    public int[] slotCounts() {
        int[] counts = new int[width()];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = Math.max(1, groupsAt(i).size());
        }
        return counts;
    }

    /**
     * Groups of every partial node, in node order.
     */
    public List<String> groupsOfAllNodes() {
        List<String> groups = new ArrayList<>();
        nodeGroups.values().forEach(groups::addAll);
        return groups;
    }

    /**
     * Index model limited to the given groups; clearance durations are shared.
     */
    public SignalGroupIndex restrictTo(Collection<String> groups) {
        Map<String, List<Integer>> kept = new LinkedHashMap<>();
        groupIndices.forEach((group, indices) -> {
            if (groups.contains(group)) {
                kept.put(group, indices);
            }
        });
        Map<Integer, List<String>> keptNodes = new TreeMap<>();
        nodeGroups.forEach((node, members) -> keptNodes.put(node,
                members.stream().filter(groups::contains).toList()));
        return new SignalGroupIndex(kept, keptNodes, clearance);
    }

    /**
     * One "index: groups" line per link index, groups in document order.
     */
    public List<String> legend() {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < width(); i++) {
            List<String> groups = new ArrayList<>();
            for (Map.Entry<String, List<Integer>> entry : groupIndices.entrySet()) {
                if (entry.getValue().contains(i)) {
                    groups.add(entry.getKey());
                }
            }
            lines.add(String.format("%2d: %s", i, String.join(" ", groups)));
        }
        return lines;
    }
}
