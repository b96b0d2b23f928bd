package org.learningjava.blockprog.domain.exception;

public class MissingRootElementException extends ProgramParseException {

    private final String expectedName;

    public MissingRootElementException(String expectedName) {
        super(ParseErrorCode.MISSING_ROOT_ELEMENT, "Cannot find <" + expectedName + "> root element");
        this.expectedName = expectedName;
    }

    public String expectedName() {
        return expectedName;
    }
}
