package org.learningjava.blockprog.domain.model.document;

import java.util.List;

/**
 * Read-only view of a parsed XML node. This is all the program assembler
 * needs from an XML library.
 */
public interface DocumentNode {

    NodeKind kind();

    /**
     * Namespace-stripped element name; empty for anything that is not an element.
     */
    String localName();

    /**
     * Attributes of an element, namespace declarations excluded; empty for other kinds.
     */
    List<DocumentAttribute> attributes();

    /**
     * Direct children in document order.
     */
    List<DocumentNode> children();

    /**
     * Character content of a text node; empty for other kinds.
     */
    String text();

    default boolean isElement() {
        return kind() == NodeKind.ELEMENT;
    }

    default boolean isText() {
        return kind() == NodeKind.TEXT;
    }
}
