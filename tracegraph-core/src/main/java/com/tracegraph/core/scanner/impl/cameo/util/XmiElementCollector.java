package com.tracegraph.core.scanner.impl.cameo.util;

import com.tracegraph.core.model.RawElement;
import com.tracegraph.core.model.StereotypeApplication;
import com.tracegraph.core.util.XmlDocuments;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the stereotype and element indices of an XMI document in one traversal.
 *
 * <p>During the traversal the collector:
 * <ul>
 *   <li>records a {@link StereotypeApplication} for every element whose tag or
 *       {@code xmi:type} contains a known stereotype keyword and that carries a
 *       {@code base_*} reference</li>
 *   <li>records a {@link RawElement} for every element with an {@code xmi:id}</li>
 *   <li>assigns each identified element the body of its first descendant
 *       {@code ownedComment} in document order</li>
 *   <li>lifts {@code client}/{@code supplier} references written as child elements
 *       ({@code <client xmi:idref="..."/>}) into the attribute map</li>
 * </ul>
 *
 * <p>When several stereotypes target the same base element, a Requirement application
 * wins; otherwise the first application seen is kept.
 *
 * <p>Instances are stateless and thread-safe.
 *
 * @since 1.0.0
 */
public class XmiElementCollector {

    /** Recognised stereotype keywords, in match order. */
    static final List<String> STEREOTYPE_KEYWORDS =
        List.of(StereotypeApplication.REQUIREMENT, "Derive", "Refine", "Satisfy", "Verify", "Trace");

    private static final String COMMENT_TAG = "ownedComment";
    private static final String BASE_PREFIX = "base_";
    private static final List<String> PREFERRED_BASES = List.of("base_Class", "base_Element");
    private static final List<String> LIFTED_REFERENCES = List.of("client", "supplier");

    /**
     * Traverses a parsed XMI document.
     *
     * @param document parsed payload
     * @return parse-scoped indices
     */
    public XmiIndex collect(Document document) {
        Traversal traversal = new Traversal();
        Element root = document.getDocumentElement();
        if (root != null) {
            traversal.visit(root);
        }
        Map<String, RawElement> elements = new LinkedHashMap<>();
        traversal.elements.forEach((id, pending) -> elements.put(id, pending.toElement()));
        return new XmiIndex(traversal.stereotypes, elements, traversal.visited);
    }

    /**
     * Returns the XMI attribute ({@code xmi:id}, {@code xmi:type}) of an element, whatever
     * prefix the document binds to the XMI namespace.
     *
     * @param element element
     * @param localName attribute local name
     * @return value or null
     */
    static String xmiAttribute(Element element, String localName) {
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (("xmi:" + localName).equals(attr.getName())) {
                return attr.getValue();
            }
            String namespace = attr.getNamespaceURI();
            if (localName.equals(attr.getLocalName()) && namespace != null && namespace.contains("XMI")) {
                return attr.getValue();
            }
        }
        return null;
    }

    /**
     * Returns the first stereotype keyword contained in the tag or declared type.
     *
     * @param tag qualified tag
     * @param declaredType declared type, may be empty
     * @return keyword or null
     */
    static String stereotypeKeyword(String tag, String declaredType) {
        for (String keyword : STEREOTYPE_KEYWORDS) {
            if (tag.contains(keyword) || declaredType.contains(keyword)) {
                return keyword;
            }
        }
        return null;
    }

    private static String baseReference(Map<String, String> attributes) {
        for (String preferred : PREFERRED_BASES) {
            String value = attributes.get(preferred);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            String key = entry.getKey();
            String local = key.contains(":") ? key.substring(key.indexOf(':') + 1) : key;
            if (local.startsWith(BASE_PREFIX) && !entry.getValue().isBlank()) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static Map<String, String> attributesOf(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap nodes = element.getAttributes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Attr attr = (Attr) nodes.item(i);
            attributes.put(attr.getName(), attr.getValue());
        }
        return attributes;
    }

    private static String firstNonBlank(Map<String, String> attributes, String... keys) {
        for (String key : keys) {
            String value = attributes.get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String commentBody(Element comment) {
        String body = XmlDocuments.attributeOrNull(comment, "body");
        if (body != null && !body.isBlank()) {
            return body;
        }
        for (Element child : XmlDocuments.childElements(comment, "body")) {
            String text = child.getTextContent();
            if (text != null && !text.isBlank()) {
                return text;
            }
        }
        return null;
    }

    private static String localName(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getNodeName();
    }

    /**
     * Mutable per-document state. Lives for one {@link #collect(Document)} call.
     */
    private static final class Traversal {
        private final Map<String, StereotypeApplication> stereotypes = new LinkedHashMap<>();
        private final Map<String, PendingElement> elements = new LinkedHashMap<>();
        private final Deque<PendingElement> ancestors = new ArrayDeque<>();
        private int visited;

        void visit(Element element) {
            visited++;
            Map<String, String> attributes = attributesOf(element);
            String tag = element.getNodeName();
            String declaredType = xmiAttribute(element, "type");
            if (declaredType == null) {
                declaredType = "";
            }

            if (COMMENT_TAG.equals(localName(element))) {
                String body = commentBody(element);
                if (body != null) {
                    for (PendingElement ancestor : ancestors) {
                        if (ancestor.commentBody == null) {
                            ancestor.commentBody = body;
                        }
                    }
                }
            }

            recordStereotype(tag, declaredType, attributes);

            String id = xmiAttribute(element, "id");
            PendingElement pending = null;
            if (id != null && !id.isEmpty()) {
                liftReferences(element, attributes);
                pending = new PendingElement(id, declaredType, tag, attributes);
                elements.putIfAbsent(id, pending);
                ancestors.push(pending);
            }

            for (Element child : XmlDocuments.childElements(element)) {
                visit(child);
            }

            if (pending != null) {
                ancestors.pop();
            }
        }

        private void recordStereotype(String tag, String declaredType, Map<String, String> attributes) {
            String keyword = stereotypeKeyword(tag, declaredType);
            if (keyword == null) {
                return;
            }
            String base = baseReference(attributes);
            if (base == null) {
                return;
            }
            StereotypeApplication application = new StereotypeApplication(
                keyword,
                firstNonBlank(attributes, "id", "Id"),
                firstNonBlank(attributes, "text", "Text"),
                firstNonBlank(attributes, "source")
            );
            StereotypeApplication existing = stereotypes.get(base);
            if (existing == null || (application.isRequirement() && !existing.isRequirement())) {
                stereotypes.put(base, application);
            }
        }

        private void liftReferences(Element element, Map<String, String> attributes) {
            for (String reference : LIFTED_REFERENCES) {
                if (attributes.containsKey(reference)) {
                    continue;
                }
                StringBuilder ids = new StringBuilder();
                for (Element child : XmlDocuments.childElements(element, reference)) {
                    String idref = xmiAttribute(child, "idref");
                    if (idref != null && !idref.isBlank()) {
                        if (ids.length() > 0) {
                            ids.append(' ');
                        }
                        ids.append(idref);
                    }
                }
                if (ids.length() > 0) {
                    attributes.put(reference, ids.toString());
                }
            }
        }
    }

    private static final class PendingElement {
        private final String id;
        private final String declaredType;
        private final String tag;
        private final Map<String, String> attributes;
        private String commentBody;

        PendingElement(String id, String declaredType, String tag, Map<String, String> attributes) {
            this.id = id;
            this.declaredType = declaredType;
            this.tag = tag;
            this.attributes = attributes;
        }

        RawElement toElement() {
            return new RawElement(id, declaredType, tag, attributes, attributes.get("source"), commentBody);
        }
    }
}
