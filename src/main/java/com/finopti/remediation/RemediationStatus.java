package com.finopti.remediation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RemediationStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    ABORTED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
