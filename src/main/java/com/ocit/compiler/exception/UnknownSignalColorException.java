package com.ocit.compiler.exception;

public class UnknownSignalColorException extends OcitCompilationException {

    private static final long serialVersionUID = 1L;

    private final String color;

    public UnknownSignalColorException(String color) {
        super("Unknown signal color '" + color + "'");
        this.color = color;
    }

    public String getColor() {
        return color;
    }
}
