package org.learningjava.blockprog.infrastructure.adapter.out.dom;

import org.learningjava.blockprog.application.port.DocumentParserPort;
import org.learningjava.blockprog.domain.exception.DocumentSyntaxException;
import org.learningjava.blockprog.domain.model.document.DocumentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.CharConversionException;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;

/**
 * Parses block editor exports with the JDK DOM parser. Namespace aware, CDATA
 * merged into text, external entities off. A DOCTYPE is rejected unless allowed,
 * and even then external DTDs are never fetched.
 */
public class DomDocumentParserAdapter implements DocumentParserPort {

    private static final Logger log = LoggerFactory.getLogger(DomDocumentParserAdapter.class);

    private final boolean allowDoctype;

    public DomDocumentParserAdapter(boolean allowDoctype) {
        this.allowDoctype = allowDoctype;
    }

    @Override
    public DocumentNode parse(String text) throws DocumentSyntaxException {
        if (text == null || text.isBlank()) {
            throw new DocumentSyntaxException("Document is empty");
        }
        return parse(new InputSource(new StringReader(text)), text.length() + " chars");
    }

    @Override
    public DocumentNode parse(byte[] content) throws DocumentSyntaxException {
        if (content == null || content.length == 0) {
            throw new DocumentSyntaxException("Document is empty");
        }
        return parse(new InputSource(new ByteArrayInputStream(content)), content.length + " bytes");
    }

    private DocumentNode parse(InputSource source, String size) throws DocumentSyntaxException {
        try {
            DocumentBuilder builder = newBuilder();
            Document document = builder.parse(source);
            log.debug("Parsed XML document ({})", size);
            return new DomDocumentNode(document);
        } catch (SAXParseException e) {
            throw new DocumentSyntaxException(
                    "Malformed XML at line " + e.getLineNumber() + ", column " + e.getColumnNumber()
                            + ": " + e.getMessage(), e);
        } catch (SAXException e) {
            throw new DocumentSyntaxException("Malformed XML: " + e.getMessage(), e);
        } catch (CharConversionException e) {
            throw new DocumentSyntaxException("Document bytes do not match its encoding: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // DocumentBuilderFactory is not thread-safe, one per call
    private DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setCoalescing(true);
            factory.setValidating(false);
            factory.setXIncludeAware(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", !allowDoctype);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setEntityResolver((publicId, systemId) -> {
                log.debug("Ignoring external entity {}", systemId);
                return new InputSource(new StringReader(""));
            });
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    log.warn("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
                }

                @Override
                public void error(SAXParseException e) throws SAXException {
                    throw e;
                }

                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support the required features", e);
        }
    }
}
