package com.ocit.compiler.signalgroup;

import lombok.experimental.UtilityClass;

/**
 * Naming conventions of OCIT signal group IDs.
 */
@UtilityClass
public class SignalGroups {

    public static final int PRIORITY_DIRECTIONAL = 0;
    public static final int PRIORITY_REGULAR = 1;
    public static final int PRIORITY_BLINKER = 2;

    /**
     * Blinkers (flashing indicators, pedestrian request lights) are exempt from
     * clearance times and complex-state reduction.
     */
    public static boolean isBlinker(String groupId) {
        return groupId.contains("BL") || groupId.contains("ge") || groupId.contains("gn") || groupId.contains("H");
    }

    /**
     * Sort key for groups sharing a link index: directional arrows (R/L) first,
     * regular heads next, blinkers last.
     */
    public static int priority(String groupId) {
        if (isBlinker(groupId)) {
            return PRIORITY_BLINKER;
        }
        if (groupId.contains("R") || groupId.contains("L")) {
            return PRIORITY_DIRECTIONAL;
        }
        return PRIORITY_REGULAR;
    }
}
