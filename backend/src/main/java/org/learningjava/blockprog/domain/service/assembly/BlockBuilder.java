package org.learningjava.blockprog.domain.service.assembly;

import org.learningjava.blockprog.domain.exception.ProgramParseException;
import org.learningjava.blockprog.domain.model.document.DocumentAttribute;
import org.learningjava.blockprog.domain.model.document.DocumentNode;
import org.learningjava.blockprog.domain.model.program.Block;
import org.learningjava.blockprog.domain.model.program.FieldValue;
import org.learningjava.blockprog.domain.model.program.StatementBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds one {@link Block} from a {@code <block>} element. Statement slots recurse
 * back into the {@link ChainResolver} that owns this builder.
 */
class BlockBuilder {

    private static final Logger log = LoggerFactory.getLogger(BlockBuilder.class);

    private final ChainResolver chainResolver;
    private final FieldValueParser fieldValueParser;

    BlockBuilder(ChainResolver chainResolver, FieldValueParser fieldValueParser) {
        this.chainResolver = chainResolver;
        this.fieldValueParser = fieldValueParser;
    }

    Block build(DocumentNode blockElement) throws ProgramParseException {
        String blockType = "";
        String id = "";
        for (DocumentAttribute attribute : blockElement.attributes()) {
            switch (attribute.localName()) {
                case BlockXmlNames.ATTR_TYPE -> blockType = attribute.value();
                case BlockXmlNames.ATTR_ID -> id = attribute.value();
                default -> {
                    // editor metadata (x, y, deletable, ...)
                }
            }
        }

        Map<String, FieldValue> fields = new LinkedHashMap<>();
        Map<String, StatementBody> statements = new LinkedHashMap<>();

        for (DocumentNode child : DocumentNodes.childElements(blockElement)) {
            switch (child.localName()) {
                case BlockXmlNames.STATEMENT -> {
                    String name = DocumentNodes.requireAttribute(child, BlockXmlNames.ATTR_NAME);
                    StatementBody body = chainResolver.resolve(DocumentNodes.firstChildElement(child).orElse(null));
                    if (statements.put(name, body) != null) {
                        log.debug("Statement {} redefined on block {}; keeping the later one", name, id);
                    }
                }
                case BlockXmlNames.FIELD -> {
                    String name = DocumentNodes.requireAttribute(child, BlockXmlNames.ATTR_NAME);
                    FieldValue value = fieldValueParser.parse(child);
                    if (fields.put(name, value) != null) {
                        log.debug("Field {} redefined on block {}; keeping the later one", name, id);
                    }
                }
                default -> {
                    // next is followed by the chain resolver, anything else is ignored
                }
            }
        }

        log.debug("Recognized block: type={} id={} fields={} statements={}",
                blockType, id, fields.keySet(), statements.keySet());
        return new Block(blockType, id, fields, statements);
    }
}
