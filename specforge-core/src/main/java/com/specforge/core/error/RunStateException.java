package com.specforge.core.error;

/**
 * Run directory, run document or event log could not be read, written or validated.
 */
public class RunStateException extends SpecForgeException {

    public RunStateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public RunStateException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
