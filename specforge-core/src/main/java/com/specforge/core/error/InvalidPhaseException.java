package com.specforge.core.error;

/**
 * A phase definition that does not satisfy the phase contract, rejected at registration.
 */
public class InvalidPhaseException extends SpecForgeException {

    public InvalidPhaseException(String message) {
        super(ErrorCode.PHASE_INVALID, message);
    }
}
