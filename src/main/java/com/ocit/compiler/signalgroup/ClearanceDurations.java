package com.ocit.compiler.signalgroup;

import java.util.HashMap;
import java.util.Map;

/**
 * Yellow and red-yellow clearance durations, in ticks, by link index and by signal group.
 * Unknown keys have duration 0.
 */
public class ClearanceDurations {

    private final Map<Integer, Integer> yellowByIndex = new HashMap<>();
    private final Map<Integer, Integer> redYellowByIndex = new HashMap<>();
    private final Map<String, Integer> yellowByGroup = new HashMap<>();
    private final Map<String, Integer> redYellowByGroup = new HashMap<>();

    public int yellow(int index) {
        return yellowByIndex.getOrDefault(index, 0);
    }

    public int redYellow(int index) {
        return redYellowByIndex.getOrDefault(index, 0);
    }

    public int yellowOfGroup(String groupId) {
        return yellowByGroup.getOrDefault(groupId, 0);
    }

    public int redYellowOfGroup(String groupId) {
        return redYellowByGroup.getOrDefault(groupId, 0);
    }

    /**
     * Yellow time of a group at one of its indices; a group never inherits a
     * longer time from another group sharing the index.
     */
    public int yellow(int index, String groupId) {
        return Math.min(yellow(index), yellowOfGroup(groupId));
    }

    public int redYellow(int index, String groupId) {
        return Math.min(redYellow(index), redYellowOfGroup(groupId));
    }

    void recordYellow(String groupId, Iterable<Integer> indices, int duration) {
        record(yellowByIndex, yellowByGroup, groupId, indices, duration);
    }

    void recordRedYellow(String groupId, Iterable<Integer> indices, int duration) {
        record(redYellowByIndex, redYellowByGroup, groupId, indices, duration);
    }

    private static void record(Map<Integer, Integer> byIndex, Map<String, Integer> byGroup, String groupId,
            Iterable<Integer> indices, int duration) {
        for (Integer index : indices) {
            byIndex.merge(index, duration, Math::max);
        }
        byGroup.merge(groupId, duration, Math::max);
    }
}
