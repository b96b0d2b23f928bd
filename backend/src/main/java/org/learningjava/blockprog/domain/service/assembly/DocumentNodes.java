package org.learningjava.blockprog.domain.service.assembly;

import org.learningjava.blockprog.domain.exception.MissingAttributeException;
import org.learningjava.blockprog.domain.model.document.DocumentAttribute;
import org.learningjava.blockprog.domain.model.document.DocumentNode;

import java.util.List;
import java.util.Optional;

/**
 * Small traversal helpers over {@link DocumentNode}. Names are matched by local name,
 * case-sensitive.
 */
final class DocumentNodes {

    private DocumentNodes() {
    }

    static List<DocumentNode> childElements(DocumentNode node) {
        return node.children().stream()
                .filter(DocumentNode::isElement)
                .toList();
    }

    static Optional<DocumentNode> firstChildElement(DocumentNode node) {
        for (DocumentNode child : node.children()) {
            if (child.isElement()) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    static Optional<DocumentNode> firstChildElement(DocumentNode node, String localName) {
        for (DocumentNode child : node.children()) {
            if (child.isElement() && localName.equals(child.localName())) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    static Optional<String> attribute(DocumentNode element, String localName) {
        for (DocumentAttribute attribute : element.attributes()) {
            if (localName.equals(attribute.localName())) {
                return Optional.of(attribute.value());
            }
        }
        return Optional.empty();
    }

    static String requireAttribute(DocumentNode element, String localName) throws MissingAttributeException {
        Optional<String> value = attribute(element, localName);
        if (value.isEmpty()) {
            throw new MissingAttributeException(element.localName(), localName);
        }
        return value.get();
    }
}
