package org.learningjava.blockprog.domain.service.assembly;

import org.learningjava.blockprog.application.port.DocumentParserPort;
import org.learningjava.blockprog.domain.exception.MissingRootElementException;
import org.learningjava.blockprog.domain.exception.ProgramParseException;
import org.learningjava.blockprog.domain.model.document.DocumentNode;
import org.learningjava.blockprog.domain.model.program.Program;
import org.learningjava.blockprog.domain.model.program.StatementBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a block editor export into a {@link Program}: one group per top-level
 * {@code <block>} under the {@code <xml>} root. Stateless; every call builds an
 * independent tree.
 */
@Component
public class ProgramAssembler {

    private static final Logger log = LoggerFactory.getLogger(ProgramAssembler.class);

    private final DocumentParserPort documentParser;
    private final ChainResolver chainResolver = new ChainResolver(new FieldValueParser());

    public ProgramAssembler(DocumentParserPort documentParser) {
        this.documentParser = documentParser;
    }

    public Program assemble(String xml) throws ProgramParseException {
        log.info("Assembling program from {} chars", xml == null ? 0 : xml.length());
        DocumentNode document = documentParser.parse(xml);
        return assemble(document);
    }

    public Program assemble(byte[] content) throws ProgramParseException {
        log.info("Assembling program from {} bytes", content == null ? 0 : content.length);
        DocumentNode document = documentParser.parse(content);
        return assemble(document);
    }

    public Program assemble(DocumentNode document) throws ProgramParseException {
        DocumentNode root = findRoot(document);

        List<StatementBody> groups = new ArrayList<>();
        for (DocumentNode child : DocumentNodes.childElements(root)) {
            switch (child.localName()) {
                case BlockXmlNames.BLOCK -> groups.add(chainResolver.resolve(child));
                // variable declarations are not modelled
                case BlockXmlNames.VARIABLES -> log.trace("Skipping <variables> section");
                default -> log.trace("Ignoring top-level <{}>", child.localName());
            }
        }

        log.info("Assembled {} groups", groups.size());
        return new Program(groups);
    }

    private static DocumentNode findRoot(DocumentNode document) throws MissingRootElementException {
        for (DocumentNode child : document.children()) {
            if (child.isElement() && BlockXmlNames.ROOT.equals(child.localName())) {
                return child;
            }
        }
        throw new MissingRootElementException(BlockXmlNames.ROOT);
    }
}
