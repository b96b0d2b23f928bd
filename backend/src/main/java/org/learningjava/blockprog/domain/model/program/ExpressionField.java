package org.learningjava.blockprog.domain.model.program;

import java.util.Objects;

/**
 * A field holding a nested value block. Never produced by the assembler yet:
 * fields of this shape fail with
 * {@link org.learningjava.blockprog.domain.exception.UnimplementedExpressionFieldException}.
 */
public record ExpressionField(Block block) implements FieldValue {

    public ExpressionField {
        Objects.requireNonNull(block, "block");
    }
}
