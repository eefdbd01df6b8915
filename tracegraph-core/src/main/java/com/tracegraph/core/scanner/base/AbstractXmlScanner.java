package com.tracegraph.core.scanner.base;

import com.tracegraph.core.archive.ModelParseException;
import com.tracegraph.core.util.XmlDocuments;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import java.io.IOException;

/**
 * Abstract base class for scanners whose payloads are XML documents.
 *
 * <p>Parsing goes through the JDK DOM parser, namespace aware and with external
 * entity resolution disabled. Malformed markup surfaces as {@link ModelParseException}.
 *
 * @see AbstractScanner
 * @since 1.0.0
 */
public abstract class AbstractXmlScanner extends AbstractScanner {

    /**
     * Parses an XML payload.
     *
     * @param content raw payload
     * @param payloadName payload name used in error messages (entry or file name)
     * @return parsed document
     * @throws ModelParseException if the payload is not well-formed
     */
    protected Document parseXml(byte[] content, String payloadName) throws ModelParseException {
        try {
            return XmlDocuments.parse(content);
        } catch (SAXException e) {
            throw new ModelParseException(payloadName, "malformed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ModelParseException(payloadName, "unreadable XML: " + e.getMessage(), e);
        }
    }
}
