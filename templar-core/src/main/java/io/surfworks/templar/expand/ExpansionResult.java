package io.surfworks.templar.expand;

import java.util.List;

import io.surfworks.templar.ir.GraphIr.Node;

/**
 * The nodes produced by one expansion.
 *
 * @param nodeName the naming seed used for local tensor names
 * @param nodes the concrete nodes, in body order
 */
public record ExpansionResult(String nodeName, List<Node> nodes) {

    public ExpansionResult {
        nodes = List.copyOf(nodes);
    }

    public int size() {
        return nodes.size();
    }
}
