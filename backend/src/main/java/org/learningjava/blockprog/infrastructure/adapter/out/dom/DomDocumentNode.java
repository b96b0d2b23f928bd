package org.learningjava.blockprog.infrastructure.adapter.out.dom;

import org.learningjava.blockprog.domain.model.document.DocumentAttribute;
import org.learningjava.blockprog.domain.model.document.DocumentNode;
import org.learningjava.blockprog.domain.model.document.NodeKind;
import org.w3c.dom.Attr;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DocumentNode} over a W3C DOM node.
 */
final class DomDocumentNode implements DocumentNode {

    private final Node node;
    private final NodeKind kind;

    DomDocumentNode(Node node) {
        this.node = node;
        this.kind = kindOf(node);
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    @Override
    public String localName() {
        if (kind != NodeKind.ELEMENT) {
            return "";
        }
        return nameOf(node);
    }

    @Override
    public List<DocumentAttribute> attributes() {
        if (kind != NodeKind.ELEMENT) {
            return List.of();
        }
        NamedNodeMap map = node.getAttributes();
        List<DocumentAttribute> out = new ArrayList<>(map.getLength());
        for (int i = 0; i < map.getLength(); i++) {
            Attr attr = (Attr) map.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            out.add(new DocumentAttribute(nameOf(attr), attr.getValue()));
        }
        return out;
    }

    @Override
    public List<DocumentNode> children() {
        NodeList list = node.getChildNodes();
        List<DocumentNode> out = new ArrayList<>(list.getLength());
        for (int i = 0; i < list.getLength(); i++) {
            out.add(new DomDocumentNode(list.item(i)));
        }
        return out;
    }

    @Override
    public String text() {
        return kind == NodeKind.TEXT ? node.getNodeValue() : "";
    }

    @Override
    public String toString() {
        return kind + (kind == NodeKind.ELEMENT ? "<" + localName() + ">" : "");
    }

    private static NodeKind kindOf(Node node) {
        return switch (node.getNodeType()) {
            case Node.DOCUMENT_NODE -> NodeKind.DOCUMENT;
            case Node.ELEMENT_NODE -> NodeKind.ELEMENT;
            case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> NodeKind.TEXT;
            default -> NodeKind.OTHER;
        };
    }

    private static String nameOf(Node node) {
        String local = node.getLocalName();
        return local != null ? local : node.getNodeName();
    }
}
