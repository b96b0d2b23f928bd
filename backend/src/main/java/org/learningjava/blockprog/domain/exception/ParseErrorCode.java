package org.learningjava.blockprog.domain.exception;

public enum ParseErrorCode {
    DOCUMENT_SYNTAX,
    // batch outcomes only: the file could not be read
    DOCUMENT_UNREADABLE,
    MISSING_ROOT_ELEMENT,
    MISSING_ATTRIBUTE,
    EMPTY_FIELD,
    UNIMPLEMENTED_EXPRESSION_FIELD
}
