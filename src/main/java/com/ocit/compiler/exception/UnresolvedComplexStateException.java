package com.ocit.compiler.exception;

/**
 * Raised when several signal groups sharing one link index show a combination
 * that the complex-state table cannot reduce to a single SUMO letter.
 */
public class UnresolvedComplexStateException extends OcitCompilationException {

    private static final long serialVersionUID = 1L;

    private final String complexState;

    public UnresolvedComplexStateException(String complexState) {
        super("Invalid complex state '" + complexState + "': no single-letter interpretation");
        this.complexState = complexState;
    }

    public UnresolvedComplexStateException(String complexState, String context) {
        super("Invalid complex state '" + complexState + "' (" + context + "): no single-letter interpretation");
        this.complexState = complexState;
    }

    public String getComplexState() {
        return complexState;
    }
}
