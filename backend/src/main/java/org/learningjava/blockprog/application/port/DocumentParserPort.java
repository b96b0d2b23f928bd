package org.learningjava.blockprog.application.port;

import org.learningjava.blockprog.domain.exception.DocumentSyntaxException;
import org.learningjava.blockprog.domain.model.document.DocumentNode;

public interface DocumentParserPort {

    /**
     * @return the document node; its children are the top-level nodes of the text
     */
    DocumentNode parse(String text) throws DocumentSyntaxException;

    /**
     * Parses raw document bytes. The character encoding comes from the XML
     * declaration or byte order mark, UTF-8 when neither is present.
     */
    DocumentNode parse(byte[] content) throws DocumentSyntaxException;
}
