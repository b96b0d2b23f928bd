package org.learningjava.blockprog.domain.model.program;

/**
 * Value of a {@code <field>} element: either plain text or a nested value block.
 */
public sealed interface FieldValue permits SimpleField, ExpressionField {
}
