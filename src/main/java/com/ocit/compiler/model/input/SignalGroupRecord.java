package com.ocit.compiler.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One signal group (Signalgruppe) as read from the document.
 */
@Value
@Builder(toBuilder = true)
public class SignalGroupRecord {

    /**
     * Short ID (BezeichnungKurz), e.g. "K1", "FR3", "BL2".
     */
    @NonNull
    String id;

    /**
     * Partial node override (AbschaltTeilknoten), null when the group belongs to the compiled node.
     */
    Integer subNode;

    /**
     * Comment text carrying the semicolon-separated SUMO link indices, e.g. "4;5".
     * Null when the group has no comment.
     */
    String comment;

    /**
     * Switch-on transition (AnwurfUebergang); its duration is the red-yellow time.
     */
    TransitionElementRecord activation;

    /**
     * Switch-off transition (AbwurfUebergang); its duration is the yellow time.
     */
    TransitionElementRecord deactivation;
}
