package org.learningjava.blockprog.domain.service.assembly;

import org.learningjava.blockprog.domain.exception.ProgramParseException;
import org.learningjava.blockprog.domain.model.document.DocumentNode;
import org.learningjava.blockprog.domain.model.program.Block;
import org.learningjava.blockprog.domain.model.program.StatementBody;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Follows {@code <next><block/></next>} links from a starting block and collects the
 * chain. The chain is assumed to be acyclic, as the export format guarantees.
 */
public class ChainResolver {

    private final BlockBuilder blockBuilder;

    public ChainResolver(FieldValueParser fieldValueParser) {
        this.blockBuilder = new BlockBuilder(this, fieldValueParser);
    }

    /**
     * @param firstBlock first block of the chain, or {@code null} for an empty slot
     */
    public StatementBody resolve(DocumentNode firstBlock) throws ProgramParseException {
        if (firstBlock == null) {
            return StatementBody.empty();
        }

        List<Block> blocks = new ArrayList<>();
        DocumentNode current = firstBlock;
        while (current != null) {
            blocks.add(blockBuilder.build(current));
            current = nextBlock(current).orElse(null);
        }
        return new StatementBody(blocks);
    }

    static Optional<DocumentNode> nextBlock(DocumentNode blockElement) {
        return DocumentNodes.firstChildElement(blockElement, BlockXmlNames.NEXT)
                .flatMap(next -> DocumentNodes.firstChildElement(next, BlockXmlNames.BLOCK));
    }
}
