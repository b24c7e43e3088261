package com.ocit.compiler.signalgroup;

import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of validating one input record: accepted, or skipped with a reason.
 */
@Value
public class RecordValidation {

    @NonNull
    String recordType;
    @NonNull
    String recordId;
    boolean accepted;
    String reason;

    public static RecordValidation accepted(String recordType, String recordId) {
        return new RecordValidation(recordType, recordId, true, null);
    }

    public static RecordValidation skipped(String recordType, String recordId, String reason) {
        return new RecordValidation(recordType, recordId, false, reason);
    }

    public boolean isSkipped() {
        return !accepted;
    }

    public String describe() {
        return accepted
                ? recordType + " '" + recordId + "' accepted"
                : recordType + " '" + recordId + "' skipped: " + reason;
    }
}
