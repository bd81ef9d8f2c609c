package com.specforge.core.error;

/**
 * A pipeline phase reported failure.
 *
 * <p>Phases may throw this from {@code run} to fail with a specific code; any other
 * exception escaping a phase is recorded as {@link ErrorCode#PHASE_FAILED}.
 */
public class PhaseFailureException extends SpecForgeException {

    private final String phaseName;

    public PhaseFailureException(String phaseName, String message) {
        this(ErrorCode.PHASE_FAILED, phaseName, message);
    }

    public PhaseFailureException(ErrorCode errorCode, String phaseName, String message) {
        super(errorCode, message);
        this.phaseName = phaseName;
    }

    public String getPhaseName() {
        return phaseName;
    }
}
