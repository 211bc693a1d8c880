package io.surfworks.templar.expand;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.surfworks.templar.ir.GraphIr.AttributeValue;
import io.surfworks.templar.ir.GraphIr.Node;

/**
 * A use of a function: the node that names the function and supplies actual
 * inputs, outputs and attribute values.
 *
 * <p>{@code nodeName} may be empty, in which case expansion derives a naming seed
 * from {@code id}.
 */
public record CallSite(
        CallSiteId id,
        String nodeName,
        String opType,
        List<String> actualInputs,
        List<String> actualOutputs,
        Map<String, AttributeValue> actualAttributes
) {
    public CallSite {
        Objects.requireNonNull(id, "id");
        nodeName = nodeName == null ? "" : nodeName;
        Objects.requireNonNull(opType, "opType");
        actualInputs = List.copyOf(actualInputs);
        actualOutputs = List.copyOf(actualOutputs);
        actualAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(actualAttributes));
    }

    /**
     * Creates a call site for a graph node, with a fresh id.
     */
    public static CallSite of(Node node) {
        return new CallSite(CallSiteId.next(), node.name(), node.opType(),
                node.inputs(), node.outputs(), node.attributes());
    }

    /**
     * Creates an unnamed call site with a fresh id.
     */
    public static CallSite of(String opType, List<String> inputs, List<String> outputs,
                              Map<String, AttributeValue> attributes) {
        return new CallSite(CallSiteId.next(), "", opType, inputs, outputs, attributes);
    }

    public Optional<String> name() {
        return nodeName.isEmpty() ? Optional.empty() : Optional.of(nodeName);
    }
}
