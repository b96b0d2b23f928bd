package org.learningjava.blockprog.domain.exception;

/**
 * Raised for a field whose content is a nested value block. Expression fields
 * are not supported; they are never turned into an empty text field.
 */
public class UnimplementedExpressionFieldException extends ProgramParseException {

    private final String fieldName;
    private final String nestedElement;

    public UnimplementedExpressionFieldException(String fieldName, String nestedElement) {
        super(ParseErrorCode.UNIMPLEMENTED_EXPRESSION_FIELD,
                "Field '" + fieldName + "' holds a nested <" + nestedElement
                        + "> element; expression fields are not implemented");
        this.fieldName = fieldName;
        this.nestedElement = nestedElement;
    }

    public String fieldName() {
        return fieldName;
    }

    public String nestedElement() {
        return nestedElement;
    }
}
