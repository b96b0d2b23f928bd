package org.learningjava.blockprog.domain.service.assembly;

import org.learningjava.blockprog.domain.exception.EmptyFieldException;
import org.learningjava.blockprog.domain.exception.UnimplementedExpressionFieldException;
import org.learningjava.blockprog.domain.model.document.DocumentNode;
import org.learningjava.blockprog.domain.model.program.FieldValue;
import org.learningjava.blockprog.domain.model.program.SimpleField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the value of one {@code <field>} element. Only the first text or element
 * child counts; comments and processing instructions are skipped.
 */
public class FieldValueParser {

    private static final Logger log = LoggerFactory.getLogger(FieldValueParser.class);

    public FieldValue parse(DocumentNode fieldElement)
            throws EmptyFieldException, UnimplementedExpressionFieldException {
        String fieldName = DocumentNodes.attribute(fieldElement, BlockXmlNames.ATTR_NAME).orElse("");

        for (DocumentNode child : fieldElement.children()) {
            if (child.isText()) {
                String text = child.text();
                log.trace("Field {} = '{}'", fieldName, text);
                return new SimpleField(text);
            }
            if (child.isElement()) {
                throw new UnimplementedExpressionFieldException(fieldName, child.localName());
            }
        }
        throw new EmptyFieldException(fieldName);
    }
}
