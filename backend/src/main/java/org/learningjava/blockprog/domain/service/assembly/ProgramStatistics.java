package org.learningjava.blockprog.domain.service.assembly;

import org.learningjava.blockprog.domain.model.program.Block;
import org.learningjava.blockprog.domain.model.program.Program;
import org.learningjava.blockprog.domain.model.program.StatementBody;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shape of an assembled program, used for logging and API responses.
 *
 * @param groups     number of top-level chains
 * @param blocks     all blocks, statement slots included
 * @param maxDepth   deepest statement nesting; a top-level block has depth 1, 0 for an empty program
 * @param blockTypes distinct block types, sorted
 */
public record ProgramStatistics(int groups, int blocks, int maxDepth, Set<String> blockTypes) {

    public static ProgramStatistics of(Program program) {
        Counter counter = new Counter();
        for (StatementBody group : program.groups()) {
            counter.visit(group, 1);
        }
        return new ProgramStatistics(program.groups().size(), counter.blocks, counter.maxDepth,
                Collections.unmodifiableSet(counter.types));
    }

    private static final class Counter {
        private int blocks;
        private int maxDepth;
        private final Set<String> types = new TreeSet<>();

        void visit(StatementBody body, int depth) {
            for (Block block : body.blocks()) {
                blocks++;
                maxDepth = Math.max(maxDepth, depth);
                types.add(block.blockType());
                for (StatementBody nested : block.statements().values()) {
                    visit(nested, depth + 1);
                }
            }
        }
    }
}
