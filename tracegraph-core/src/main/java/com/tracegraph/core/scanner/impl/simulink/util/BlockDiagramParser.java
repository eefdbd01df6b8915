package com.tracegraph.core.scanner.impl.simulink.util;

import com.tracegraph.core.model.Block;
import com.tracegraph.core.model.BlockDiagram;
import com.tracegraph.core.model.Connection;
import com.tracegraph.core.model.PortKind;
import com.tracegraph.core.model.Position;
import com.tracegraph.core.model.SignalEndpoint;
import com.tracegraph.core.scanner.ScanStatistics;
import com.tracegraph.core.util.XmlDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses block-diagram descriptors into blocks and signal connections.
 *
 * <p>The root descriptor contributes model-level properties only. Every {@code Block} element
 * of a system descriptor becomes a {@link Block}; every {@code Line} becomes one connection from
 * its {@code Src} to its own {@code Dst}, plus one connection per {@code Branch} (nested branches
 * included) from the same source to the branch destination. {@code Src}, {@code Dst} and
 * {@code Name} are looked up among direct children only, so a branch destination is never taken
 * for the line's own.
 *
 * <p>Endpoint grammar: {@code <sid>#out:<port>}, {@code <sid>#in:<port>} and {@code <sid>#state}
 * (port 0). Lines whose source cannot be parsed are skipped entirely; an unparseable destination
 * skips that connection only. Blocks without a SID are skipped. All skips are counted.
 *
 * @since 1.0.0
 */
public class BlockDiagramParser {

    private static final Logger log = LoggerFactory.getLogger(BlockDiagramParser.class);

    private static final Pattern PORT_ENDPOINT = Pattern.compile("^(\\d+)#(out|in):(\\d+)");
    private static final Pattern STATE_ENDPOINT = Pattern.compile("^(\\d+)#state");
    private static final Set<String> EXCLUDED_PROPERTIES = Set.of("Position", "ZOrder");

    /**
     * Parses a model.
     *
     * @param modelName model name
     * @param rootDescriptor parsed {@code blockdiagram.xml}, or null when absent
     * @param systemDescriptors parsed system descriptors keyed by base name
     * @param stats statistics to record skips into
     * @return parsed diagram
     */
    public BlockDiagram parse(String modelName, Document rootDescriptor,
                              Map<String, Document> systemDescriptors, ScanStatistics.Builder stats) {
        Map<String, String> modelProperties = rootDescriptor != null
            ? parseModelProperties(rootDescriptor)
            : Map.of();

        Map<String, Block> blocks = new LinkedHashMap<>();
        List<Connection> connections = new ArrayList<>();
        systemDescriptors.forEach((systemName, descriptor) -> {
            Element root = descriptor.getDocumentElement();
            if (root == null) {
                return;
            }
            for (Element element : blockElements(root)) {
                stats.incrementElementsVisited();
                Block block = parseBlock(element, systemName);
                if (block == null) {
                    stats.addSkip("missing SID", systemName + ": block '" + element.getAttribute("Name") + "' has no SID");
                    continue;
                }
                blocks.put(block.sid(), block);
            }
            for (Element line : lineElements(root)) {
                stats.incrementElementsVisited();
                parseLine(line, systemName, connections, stats);
            }
        });

        log.debug("Parsed {} blocks and {} connections from model {}", blocks.size(), connections.size(), modelName);
        return new BlockDiagram(modelName, modelProperties, new ArrayList<>(blocks.values()), connections);
    }

    /**
     * Parses an endpoint string.
     *
     * @param endpoint endpoint text, e.g. "10#out:1"
     * @return parsed endpoint, or null when the text does not follow the endpoint grammar
     */
    public static SignalEndpoint parseEndpoint(String endpoint) {
        if (endpoint == null) {
            return null;
        }
        String text = endpoint.trim();
        Matcher port = PORT_ENDPOINT.matcher(text);
        if (port.find()) {
            PortKind kind = "out".equals(port.group(2)) ? PortKind.OUT : PortKind.IN;
            return new SignalEndpoint(port.group(1), kind, Integer.parseInt(port.group(3)));
        }
        Matcher state = STATE_ENDPOINT.matcher(text);
        if (state.find()) {
            return new SignalEndpoint(state.group(1), PortKind.STATE, 0);
        }
        return null;
    }

    /**
     * Parses a position text of the form {@code [x, y, w, h]}.
     *
     * @param text position text, may be null
     * @return position, or {@link Position#DEFAULT} when absent or not four integers
     */
    public static Position parsePosition(String text) {
        if (text == null) {
            return Position.DEFAULT;
        }
        String inner = text.trim();
        if (inner.startsWith("[")) {
            inner = inner.substring(1);
        }
        if (inner.endsWith("]")) {
            inner = inner.substring(0, inner.length() - 1);
        }
        String[] parts = inner.split(",");
        if (parts.length != 4) {
            return Position.DEFAULT;
        }
        try {
            return new Position(
                Integer.parseInt(parts[0].trim()),
                Integer.parseInt(parts[1].trim()),
                Integer.parseInt(parts[2].trim()),
                Integer.parseInt(parts[3].trim()));
        } catch (NumberFormatException e) {
            return Position.DEFAULT;
        }
    }

    private Map<String, String> parseModelProperties(Document rootDescriptor) {
        Map<String, String> properties = new LinkedHashMap<>();
        Element root = rootDescriptor.getDocumentElement();
        if (root == null) {
            return properties;
        }
        List<Element> models = new ArrayList<>();
        if ("Model".equals(root.getNodeName())) {
            models.add(root);
        }
        models.addAll(XmlDocuments.descendants(root, "Model"));
        for (Element model : models) {
            for (Element property : XmlDocuments.descendants(model, "P")) {
                String name = property.getAttribute("Name");
                if (!name.isEmpty()) {
                    properties.put(name, property.getTextContent());
                }
            }
        }
        return properties;
    }

    private Block parseBlock(Element element, String systemName) {
        String sid = element.getAttribute("SID");
        if (sid.isBlank()) {
            return null;
        }

        Position position = Position.DEFAULT;
        boolean positionSeen = false;
        Map<String, String> properties = new LinkedHashMap<>();
        for (Element property : XmlDocuments.descendants(element, "P")) {
            String name = property.getAttribute("Name");
            if (name.isEmpty()) {
                continue;
            }
            if ("Position".equals(name)) {
                if (!positionSeen) {
                    position = parsePosition(property.getTextContent());
                    positionSeen = true;
                }
            } else if (!EXCLUDED_PROPERTIES.contains(name)) {
                properties.put(name, property.getTextContent());
            }
        }

        int inputPorts = 0;
        int outputPorts = 0;
        List<Element> portCounts = XmlDocuments.descendants(element, "PortCounts");
        if (!portCounts.isEmpty()) {
            inputPorts = parseCount(portCounts.get(0).getAttribute("in"));
            outputPorts = parseCount(portCounts.get(0).getAttribute("out"));
        }

        return new Block(
            sid,
            element.getAttribute("Name"),
            element.getAttribute("BlockType"),
            position,
            properties,
            systemName,
            inputPorts,
            outputPorts
        );
    }

    private void parseLine(Element line, String systemName, List<Connection> connections, ScanStatistics.Builder stats) {
        String src = directProperty(line, "Src");
        SignalEndpoint source = parseEndpoint(src);
        if (source == null) {
            stats.addSkip("unparseable endpoint", systemName + ": line source '" + src + "'");
            return;
        }
        String signalName = directProperty(line, "Name");

        String dst = directProperty(line, "Dst");
        if (dst != null) {
            addConnection(source, dst, signalName, systemName, connections, stats);
        }
        addBranches(line, source, signalName, systemName, connections, stats);
    }

    private void addBranches(Element parent, SignalEndpoint source, String signalName, String systemName,
                             List<Connection> connections, ScanStatistics.Builder stats) {
        for (Element branch : XmlDocuments.childElements(parent, "Branch")) {
            String dst = directProperty(branch, "Dst");
            if (dst != null) {
                addConnection(source, dst, signalName, systemName, connections, stats);
            }
            addBranches(branch, source, signalName, systemName, connections, stats);
        }
    }

    private void addConnection(SignalEndpoint source, String dst, String signalName, String systemName,
                               List<Connection> connections, ScanStatistics.Builder stats) {
        SignalEndpoint destination = parseEndpoint(dst);
        if (destination == null) {
            stats.addSkip("unparseable endpoint", systemName + ": destination '" + dst + "'");
            return;
        }
        connections.add(Connection.between(source, destination, signalName));
        stats.incrementEdgesCollected();
    }

    private static String directProperty(Element parent, String name) {
        for (Element property : XmlDocuments.childElements(parent, "P")) {
            if (name.equals(property.getAttribute("Name"))) {
                return property.getTextContent();
            }
        }
        return null;
    }

    private static List<Element> blockElements(Element root) {
        List<Element> blocks = new ArrayList<>();
        if ("Block".equals(root.getNodeName())) {
            blocks.add(root);
        }
        blocks.addAll(XmlDocuments.descendants(root, "Block"));
        return blocks;
    }

    private static List<Element> lineElements(Element root) {
        return XmlDocuments.descendants(root, "Line");
    }

    private static int parseCount(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
