package com.specforge.core.error;

/**
 * Malformed front matter in a specification document.
 *
 * <p>Thrown by the parser only for front matter that cannot be decoded. An undecodable
 * structured-data block in the body is not thrown; it is recorded on the parsed
 * specification as a {@link com.specforge.core.model.ParseIssue} with
 * {@link ErrorCode#PARSE_BLOCK}.
 */
public class ParseFault extends SpecForgeException {

    public ParseFault(String message) {
        super(ErrorCode.PARSE_FRONT_MATTER, message);
    }

    public ParseFault(String message, Throwable cause) {
        super(ErrorCode.PARSE_FRONT_MATTER, message, cause);
    }
}
