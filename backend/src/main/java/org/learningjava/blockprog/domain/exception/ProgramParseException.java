package org.learningjava.blockprog.domain.exception;

/**
 * Base of every failure that aborts building a program from a document.
 * The first failure in document order wins; no partial program is returned.
 */
public abstract class ProgramParseException extends Exception {

    private final ParseErrorCode code;

    protected ProgramParseException(ParseErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected ProgramParseException(ParseErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ParseErrorCode code() {
        return code;
    }
}
