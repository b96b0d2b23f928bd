package org.learningjava.blockprog.domain.model.program;

import java.util.List;

/**
 * A whole block-editor document: one {@link StatementBody} per top-level
 * block chain, in document order.
 */
public record Program(List<StatementBody> groups) {

    public Program {
        groups = List.copyOf(groups);
    }
}
