package com.tracegraph.core.graph;

import com.tracegraph.core.model.Block;
import com.tracegraph.core.model.BlockDiagram;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;
import com.tracegraph.core.model.Connection;
import com.tracegraph.core.model.NodeCollision;
import com.tracegraph.core.model.Requirement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adapts requirements and blocks to the canonical node shape.
 *
 * <p>Requirement nodes are keyed by business id. Their incoming list holds derivation
 * sources, their outgoing list the union of refine, satisfy, verify and trace targets,
 * each projected from internal id to business id. When two requirements share a business
 * id the later one wins and a {@link NodeCollision} is recorded.
 *
 * <p>Block nodes are keyed by sid. Incoming and outgoing are literal per-connection lists;
 * connections whose source or destination is not a block of the model are left out.
 *
 * @since 1.0.0
 */
public final class CanonicalGraphBuilder {

    /** Prefix of requirement node types. */
    public static final String REQUIREMENT_TYPE_PREFIX = "Requirement_";

    private CanonicalGraphBuilder() {
    }

    /**
     * Builds the graph of one requirements model.
     *
     * @param source graph label, usually the archive file name
     * @param requirements requirements with resolved relationships
     * @return canonical graph
     */
    public static CanonicalGraph fromRequirements(String source, Collection<Requirement> requirements) {
        Map<String, String> businessIds = new HashMap<>();
        for (Requirement requirement : requirements) {
            businessIds.put(requirement.xmiId(), requirement.reqId());
        }

        Map<String, CanonicalNode> nodes = new LinkedHashMap<>();
        List<NodeCollision> collisions = new ArrayList<>();
        for (Requirement requirement : requirements) {
            CanonicalNode node = toNode(requirement, businessIds);
            CanonicalNode previous = nodes.put(node.id(), node);
            if (previous != null) {
                collisions.add(new NodeCollision(node.id(), describe(previous), describe(node)));
            }
        }
        return new CanonicalGraph(source, nodes, collisions);
    }

    /**
     * Builds the graph of one block diagram.
     *
     * @param diagram parsed block diagram
     * @return canonical graph labelled with the model name
     */
    public static CanonicalGraph fromBlockDiagram(BlockDiagram diagram) {
        Map<String, Block> blocks = new LinkedHashMap<>();
        for (Block block : diagram.blocks()) {
            blocks.put(block.sid(), block);
        }

        Map<String, List<String>> incoming = new HashMap<>();
        Map<String, List<String>> outgoing = new HashMap<>();
        for (Connection connection : diagram.connections()) {
            if (blocks.containsKey(connection.sourceBlock()) && blocks.containsKey(connection.destBlock())) {
                outgoing.computeIfAbsent(connection.sourceBlock(), k -> new ArrayList<>()).add(connection.destBlock());
                incoming.computeIfAbsent(connection.destBlock(), k -> new ArrayList<>()).add(connection.sourceBlock());
            }
        }

        Map<String, CanonicalNode> nodes = new LinkedHashMap<>();
        for (Block block : blocks.values()) {
            nodes.put(block.sid(), new CanonicalNode(
                block.sid(),
                block.name(),
                block.blockType(),
                null,
                null,
                incoming.getOrDefault(block.sid(), List.of()),
                outgoing.getOrDefault(block.sid(), List.of()),
                blockProperties(block, diagram.modelName()),
                diagram.modelName()
            ));
        }
        return new CanonicalGraph(diagram.modelName(), nodes, List.of());
    }

    /**
     * Counts connections that reference a sid which is not a block of the diagram.
     *
     * @param diagram parsed block diagram
     * @return number of unresolved connections
     */
    public static int countUnresolvedConnections(BlockDiagram diagram) {
        Set<String> sids = new HashSet<>();
        for (Block block : diagram.blocks()) {
            sids.add(block.sid());
        }
        int misses = 0;
        for (Connection connection : diagram.connections()) {
            if (!sids.contains(connection.sourceBlock()) || !sids.contains(connection.destBlock())) {
                misses++;
            }
        }
        return misses;
    }

    static CanonicalNode toNode(Requirement requirement, Map<String, String> businessIds) {
        List<String> incoming = project(requirement.derivesFrom(), businessIds);

        Set<String> outgoing = new LinkedHashSet<>();
        outgoing.addAll(project(requirement.refines(), businessIds));
        outgoing.addAll(project(requirement.satisfies(), businessIds));
        outgoing.addAll(project(requirement.verifies(), businessIds));
        outgoing.addAll(project(requirement.tracesTo(), businessIds));

        return new CanonicalNode(
            requirement.reqId(),
            requirement.name(),
            REQUIREMENT_TYPE_PREFIX + requirement.reqType(),
            requirement.text(),
            requirement.xmiId(),
            incoming,
            new ArrayList<>(outgoing),
            new LinkedHashMap<>(requirement.properties()),
            requirement.sourceFile()
        );
    }

    private static List<String> project(List<String> internalIds, Map<String, String> businessIds) {
        Set<String> projected = new LinkedHashSet<>();
        for (String internalId : internalIds) {
            String businessId = businessIds.get(internalId);
            if (businessId != null) {
                projected.add(businessId);
            }
        }
        return new ArrayList<>(projected);
    }

    private static Map<String, Object> blockProperties(Block block, String modelName) {
        Map<String, Object> properties = new LinkedHashMap<>(block.properties());
        properties.put("parent_system", block.parentSystem());
        properties.put("model_name", modelName);
        properties.put("position", List.of(
            block.position().x(), block.position().y(), block.position().width(), block.position().height()));
        properties.put("input_ports", block.inputPorts());
        properties.put("output_ports", block.outputPorts());
        return properties;
    }

    private static String describe(CanonicalNode node) {
        return node.xmiId() != null ? node.sourceFile() + "#" + node.xmiId() : node.sourceFile();
    }
}
