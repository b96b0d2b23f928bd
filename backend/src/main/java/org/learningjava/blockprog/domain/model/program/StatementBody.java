package org.learningjava.blockprog.domain.model.program;

import java.util.List;

/**
 * Blocks of one next-chain, in chain order (first block, its next block, ...).
 */
public record StatementBody(List<Block> blocks) {

    private static final StatementBody EMPTY = new StatementBody(List.of());

    public StatementBody {
        blocks = List.copyOf(blocks);
    }

    public static StatementBody empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
