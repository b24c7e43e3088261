package com.ocit.compiler.model.core.context;

import java.util.ArrayList;
import java.util.List;

import com.ocit.compiler.signalgroup.RecordValidation;

import lombok.Getter;

/**
 * Errors, warnings and infos accumulated during one compiler run.
 *
 * Pure structure only: no logging, no formatting.
 */
@Getter
public class CompileDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();
    private final List<RecordValidation> skippedRecords = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public void addInfo(String info) {
        infos.add(info);
    }

    public void recordSkipped(RecordValidation validation) {
        skippedRecords.add(validation);
        warnings.add(validation.describe());
    }
}
