package org.learningjava.blockprog.domain.exception;

public class DocumentSyntaxException extends ProgramParseException {

    public DocumentSyntaxException(String message) {
        super(ParseErrorCode.DOCUMENT_SYNTAX, message);
    }

    public DocumentSyntaxException(String message, Throwable cause) {
        super(ParseErrorCode.DOCUMENT_SYNTAX, message, cause);
    }
}
