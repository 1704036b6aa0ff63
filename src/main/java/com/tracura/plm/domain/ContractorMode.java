package com.tracura.plm.domain;

import java.util.Arrays;

/**
 * How a department's work is contracted.
 */
public enum ContractorMode {
    LABOUR_ONLY("Labour-Only"),
    TURNKEY("Turnkey");

    private final String label;

    ContractorMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts either the stored label ("Labour-Only") or the constant name.
     * Unrecognised values fall back to LABOUR_ONLY.
     */
    public static ContractorMode fromLabel(String value) {
        if (value == null) {
            return LABOUR_ONLY;
        }
        return Arrays.stream(values())
            .filter(m -> m.label.equalsIgnoreCase(value.trim()) || m.name().equalsIgnoreCase(value.trim()))
            .findFirst()
            .orElse(LABOUR_ONLY);
    }
}
