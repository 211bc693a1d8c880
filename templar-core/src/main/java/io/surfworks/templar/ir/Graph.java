package io.surfworks.templar.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.surfworks.templar.ir.GraphIr.Node;

/**
 * A graph with an ordered, append-only node list.
 *
 * <p>Graphs are not synchronized. Callers that append from several threads to the
 * same graph must serialize those appends themselves.
 */
public final class Graph {

    private final String name;
    private final List<String> inputs;
    private final List<String> outputs;
    private final List<Node> nodes;

    public Graph(String name) {
        this(name, List.of(), List.of());
    }

    public Graph(String name, List<String> inputs, List<String> outputs) {
        this.name = Objects.requireNonNull(name, "name");
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.nodes = new ArrayList<>();
    }

    public String name() {
        return name;
    }

    /**
     * Returns the names of the tensors fed into this graph.
     */
    public List<String> inputs() {
        return inputs;
    }

    /**
     * Returns the names of the tensors this graph produces.
     */
    public List<String> outputs() {
        return outputs;
    }

    /**
     * Returns a read-only view of the nodes in insertion order.
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public Graph append(Node node) {
        nodes.add(Objects.requireNonNull(node, "node"));
        return this;
    }

    /**
     * Appends all nodes in order. Either every node is appended or none is.
     */
    public Graph appendAll(List<Node> newNodes) {
        for (Node node : newNodes) {
            Objects.requireNonNull(node, "node");
        }
        nodes.addAll(newNodes);
        return this;
    }

    /**
     * Returns a new graph with the same name and boundary but no nodes.
     */
    public Graph emptyCopy() {
        return new Graph(name, inputs, outputs);
    }

    /**
     * Renders the graph as {@code graph @name(ins) -> (outs) { ... }}, one node per line.
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append("graph @").append(name)
                .append("(").append(String.join(", ", inputs)).append(")")
                .append(" -> (").append(String.join(", ", outputs)).append(") {\n");
        for (Node node : nodes) {
            sb.append("  ").append(node.toText()).append("\n");
        }
        sb.append("}");
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("Graph[name=%s, nodes=%d]", name, nodes.size());
    }
}
