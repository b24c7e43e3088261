package com.ocit.compiler.exception;

/**
 * A program row declares neither switching times nor a permanent signal picture.
 */
public class MalformedProgramRowException extends OcitCompilationException {

    private static final long serialVersionUID = 1L;

    public MalformedProgramRowException(String programId, String groupId) {
        super("Neither switches nor permanent signal state were given. Cannot interpret signal state for group "
                + groupId + " (program " + programId + ")");
    }
}
