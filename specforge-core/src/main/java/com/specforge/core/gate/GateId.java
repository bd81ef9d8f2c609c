package com.specforge.core.gate;

/**
 * Identifiers of the four validation gates, in evaluation order.
 */
public enum GateId {
    G1("Structure Validation"),
    G2("Semantic Validation"),
    G3("Traceability Validation"),
    G4("Invariant Verification");

    private final String displayName;

    GateId(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
