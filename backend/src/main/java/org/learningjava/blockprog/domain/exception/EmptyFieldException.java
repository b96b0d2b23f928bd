package org.learningjava.blockprog.domain.exception;

public class EmptyFieldException extends ProgramParseException {

    private final String fieldName;

    public EmptyFieldException(String fieldName) {
        super(ParseErrorCode.EMPTY_FIELD, "Expected child nodes for field '" + fieldName + "'");
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
