package org.learningjava.blockprog.domain.exception;

/**
 * A {@code <statement>} or {@code <field>} element without its {@code name} attribute.
 */
public class MissingAttributeException extends ProgramParseException {

    private final String element;
    private final String attribute;

    public MissingAttributeException(String element, String attribute) {
        super(ParseErrorCode.MISSING_ATTRIBUTE,
                "Element <" + element + "> is missing required attribute '" + attribute + "'");
        this.element = element;
        this.attribute = attribute;
    }

    public String element() {
        return element;
    }

    public String attribute() {
        return attribute;
    }
}
