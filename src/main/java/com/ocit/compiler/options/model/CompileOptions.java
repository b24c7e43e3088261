package com.ocit.compiler.options.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Raw compiler options as handed over by the command line layer. No validation,
 * no parsing: list options are still comma-separated strings.
 */
@Getter
@Builder(toBuilder = true)
public class CompileOptions {

    @Builder.Default
    private String tlsId = "TLS_ID";

    @Builder.Default
    private int minDuration = 5;

    @Builder.Default
    private int phaseDuration = 100;

    /**
     * Comma-separated link indices that always get minor green.
     */
    private String minorIndices;

    /**
     * Comma-separated signal groups that always get major green.
     */
    private String majorGroups;

    /**
     * Comma-separated phase tags to ignore.
     */
    private String ignorePhases;

    /**
     * Comma-separated partial nodes to ignore.
     */
    private String ignoreNodes;

    private boolean noGrouping;

    private boolean usePrograms;

    private boolean verbose;

    private Integer verboseIndex;

    private String verboseGroup;

    private String verboseTransition;
}
