package io.surfworks.templar.function;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A node in a function body.
 *
 * <p>Input and output references name either a formal input/output of the
 * enclosing function or a tensor local to the body.
 */
public record TemplateNode(
        String opType,
        List<String> inputRefs,
        List<String> outputRefs,
        Map<String, AttributeSpec> attributeSpecs
) {
    public TemplateNode {
        Objects.requireNonNull(opType, "opType");
        inputRefs = List.copyOf(inputRefs);
        outputRefs = List.copyOf(outputRefs);
        attributeSpecs = Collections.unmodifiableMap(new LinkedHashMap<>(attributeSpecs));
    }

    @Override
    public String toString() {
        String attrs = attributeSpecs.isEmpty() ? "" : attributeSpecs.entrySet().stream()
                .map(e -> e.getKey() + " = " + e.getValue())
                .collect(Collectors.joining(", ", "<", ">"));
        return String.join(", ", outputRefs) + " = " + opType + attrs
                + "(" + String.join(", ", inputRefs) + ")";
    }
}
