package com.ocit.compiler.model.core.context;

import lombok.Value;

/**
 * Selects the link index, signal group and/or transition for which extra
 * trace output is logged.
 */
@Value
public class TraceSelector {
    Integer index;
    String group;
    String transition;

    public static TraceSelector none() {
        return new TraceSelector(null, null, null);
    }

    public boolean isActive() {
        return index != null || group != null || transition != null;
    }

    /**
     * True when tracing is active and every configured selector matches. A null
     * argument means the dimension does not apply and matches anything.
     */
    public boolean matches(String transitionId, String groupId, Integer linkIndex) {
        return isActive()
                && (index == null || linkIndex == null || index.equals(linkIndex))
                && (transition == null || transitionId == null || transitionId.contains(transition))
                && (group == null || groupId == null || group.equals(groupId));
    }
}
