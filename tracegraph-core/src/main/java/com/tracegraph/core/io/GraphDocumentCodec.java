package com.tracegraph.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.tracegraph.core.archive.ModelParseException;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the canonical graph document.
 *
 * <p>Document shape:
 * <pre>{@code
 * {
 *   "nodes": {
 *     "<id>": {
 *       "name": "...", "node_type": "...", "text": "...", "xmi_id": "...",
 *       "incoming": ["<id>"], "outgoing": ["<id>"], "properties": {}, "source_file": "..."
 *     }
 *   }
 * }
 * }</pre>
 * {@code text} and {@code xmi_id} are written only when present.
 *
 * @since 1.0.0
 */
public final class GraphDocumentCodec {

    private static final TypeReference<Map<String, Object>> PROPERTIES = new TypeReference<>() {};

    private GraphDocumentCodec() {
    }

    /**
     * Returns the document body of one node, without its id.
     *
     * @param node node
     * @return ordered body map
     */
    public static Map<String, Object> nodeBody(CanonicalNode node) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", node.name());
        body.put("node_type", node.nodeType());
        if (node.text() != null) {
            body.put("text", node.text());
        }
        if (node.xmiId() != null) {
            body.put("xmi_id", node.xmiId());
        }
        body.put("incoming", node.incoming());
        body.put("outgoing", node.outgoing());
        body.put("properties", node.properties());
        body.put("source_file", node.sourceFile());
        return body;
    }

    /**
     * Builds the document of a graph.
     *
     * @param graph graph
     * @return document map
     */
    public static Map<String, Object> toDocument(CanonicalGraph graph) {
        Map<String, Object> nodes = new LinkedHashMap<>();
        graph.nodes().forEach((id, node) -> nodes.put(id, nodeBody(node)));
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("nodes", nodes);
        return document;
    }

    /**
     * Serializes a graph as an indented document.
     *
     * @param graph graph
     * @return JSON text
     */
    public static String write(CanonicalGraph graph) {
        try {
            return JsonMappers.documents().writeValueAsString(toDocument(graph));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize graph " + graph.source(), e);
        }
    }

    /**
     * Reads a graph document from a file.
     *
     * @param file document path
     * @return graph labelled with the file name
     * @throws IOException if the file cannot be read or is not a graph document
     */
    public static CanonicalGraph read(Path file) throws IOException {
        return parse(Files.readString(file), file.getFileName().toString());
    }

    /**
     * Parses a graph document.
     *
     * @param json document text
     * @param source label of the resulting graph
     * @return graph
     * @throws ModelParseException if the text is not a graph document
     */
    public static CanonicalGraph parse(String json, String source) throws ModelParseException {
        JsonNode root;
        try {
            root = JsonMappers.documents().readTree(json);
        } catch (JsonProcessingException e) {
            throw new ModelParseException(source, "malformed JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode nodesNode = root == null ? null : root.get("nodes");
        if (nodesNode == null || !nodesNode.isObject()) {
            throw new ModelParseException(source, "document has no \"nodes\" object", null);
        }

        Map<String, CanonicalNode> nodes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = nodesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            nodes.put(entry.getKey(), toNode(entry.getKey(), entry.getValue()));
        }
        return new CanonicalGraph(source, nodes, List.of());
    }

    private static CanonicalNode toNode(String id, JsonNode body) {
        Map<String, Object> properties = body.hasNonNull("properties")
            ? JsonMappers.documents().convertValue(body.get("properties"), PROPERTIES)
            : Map.of();
        return new CanonicalNode(
            id,
            text(body, "name"),
            text(body, "node_type"),
            text(body, "text"),
            text(body, "xmi_id"),
            strings(body.get("incoming")),
            strings(body.get("outgoing")),
            properties,
            text(body, "source_file")
        );
    }

    private static String text(JsonNode body, String field) {
        JsonNode value = body.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(value -> values.add(value.asText()));
        }
        return values;
    }
}
