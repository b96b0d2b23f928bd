package org.learningjava.blockprog.domain.service.assembly;

import org.learningjava.blockprog.domain.exception.DocumentSyntaxException;
import org.learningjava.blockprog.domain.model.document.DocumentNode;
import org.learningjava.blockprog.infrastructure.adapter.out.dom.DomDocumentParserAdapter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

final class TestDocuments {

    static final DomDocumentParserAdapter PARSER = new DomDocumentParserAdapter(false);

    private TestDocuments() {
    }

    /** Root element of an XML fragment. */
    static DocumentNode element(String xml) throws DocumentSyntaxException {
        return PARSER.parse(xml).children().stream()
                .filter(DocumentNode::isElement)
                .findFirst()
                .orElseThrow();
    }

    static String resource(String name) throws IOException {
        try (InputStream in = TestDocuments.class.getResourceAsStream(name)) {
            if (in == null) throw new IllegalStateException("Missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
