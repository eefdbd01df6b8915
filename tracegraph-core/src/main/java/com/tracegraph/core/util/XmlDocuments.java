package com.tracegraph.core.util;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM parsing and navigation helpers.
 *
 * <p>Documents are parsed namespace aware with external entities and DTD loading disabled.
 */
public final class XmlDocuments {

    private static final ErrorHandler RETHROWING = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            // warnings do not affect the parsed tree
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private XmlDocuments() {
        // Utility class
    }

    /**
     * Parses XML bytes into a namespace-aware DOM document.
     *
     * @param content XML content
     * @return parsed document
     * @throws SAXException if the content is not well-formed
     * @throws IOException if the content cannot be read
     */
    public static Document parse(byte[] content) throws SAXException, IOException {
        DocumentBuilder builder = newBuilder();
        return builder.parse(new ByteArrayInputStream(content));
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(RETHROWING);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration not supported", e);
        }
    }

    /**
     * Returns the direct child elements of an element.
     *
     * @param parent parent element
     * @return child elements in document order
     */
    public static List<Element> childElements(Element parent) {
        List<Element> children = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                children.add((Element) node);
            }
        }
        return children;
    }

    /**
     * Returns the direct child elements with a given name (qualified or local).
     *
     * @param parent parent element
     * @param name element name
     * @return matching children in document order
     */
    public static List<Element> childElements(Element parent, String name) {
        List<Element> matches = new ArrayList<>();
        for (Element child : childElements(parent)) {
            if (name.equals(child.getNodeName()) || name.equals(child.getLocalName())) {
                matches.add(child);
            }
        }
        return matches;
    }

    /**
     * Returns all descendant elements with a given name in document order.
     *
     * @param root subtree root (not included)
     * @param name element name
     * @return matching descendants
     */
    public static List<Element> descendants(Element root, String name) {
        List<Element> matches = new ArrayList<>();
        NodeList nodes = root.getElementsByTagName(name);
        for (int i = 0; i < nodes.getLength(); i++) {
            matches.add((Element) nodes.item(i));
        }
        return matches;
    }

    /**
     * Returns an attribute value, or null when the attribute is absent.
     *
     * @param element element
     * @param name attribute name
     * @return value or null
     */
    public static String attributeOrNull(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }
}
