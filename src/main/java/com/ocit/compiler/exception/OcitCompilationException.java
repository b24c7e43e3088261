package com.ocit.compiler.exception;

/**
 * Base type for errors that make a cycle or program impossible to compile.
 */
public class OcitCompilationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public OcitCompilationException(String message) {
        super(message);
    }
}
