package io.surfworks.templar.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Value classes for the dataflow graph IR.
 *
 * <p>Nodes reference tensors by name only. A graph's namespace is flat, so two
 * nodes writing the same output name refer to the same tensor.
 */
public final class GraphIr {

    private GraphIr() {}

    // ==================== Tensors ====================

    /**
     * A constant tensor, as carried by {@code tensor} attributes.
     */
    public record TensorLiteral(String name, String elementType, List<Long> dims, List<Double> data) {
        public TensorLiteral {
            name = name == null ? "" : name;
            Objects.requireNonNull(elementType, "elementType");
            dims = List.copyOf(dims);
            data = List.copyOf(data);
        }

        public long elementCount() {
            long count = 1;
            for (long d : dims) {
                count *= d;
            }
            return count;
        }

        public String toText() {
            return "tensor<" + dims.stream().map(String::valueOf).collect(Collectors.joining("x"))
                    + (dims.isEmpty() ? "" : "x") + elementType + ">" + data;
        }
    }

    // ==================== Attribute values ====================

    /**
     * A concrete attribute value. Exactly one variant per {@link AttributeType}.
     */
    public sealed interface AttributeValue permits
            FloatValue, IntValue, StringValue, TensorValue, GraphValue,
            FloatsValue, IntsValue, StringsValue, TensorsValue, GraphsValue {

        AttributeType type();

        String toText();
    }

    public record FloatValue(float value) implements AttributeValue {
        @Override
        public AttributeType type() { return AttributeType.FLOAT; }

        @Override
        public String toText() {
            return String.valueOf(value);
        }
    }

    public record IntValue(long value) implements AttributeValue {
        @Override
        public AttributeType type() { return AttributeType.INT; }

        @Override
        public String toText() {
            return String.valueOf(value);
        }
    }

    public record StringValue(String value) implements AttributeValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public AttributeType type() { return AttributeType.STRING; }

        @Override
        public String toText() {
            return "\"" + value + "\"";
        }
    }

    public record TensorValue(TensorLiteral value) implements AttributeValue {
        public TensorValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public AttributeType type() { return AttributeType.TENSOR; }

        @Override
        public String toText() {
            return value.toText();
        }
    }

    /**
     * A nested subgraph, e.g. the body of a loop or a branch.
     */
    public record GraphValue(Graph value) implements AttributeValue {
        public GraphValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public AttributeType type() { return AttributeType.GRAPH; }

        @Override
        public String toText() {
            return "graph @" + value.name();
        }
    }

    public record FloatsValue(List<Float> values) implements AttributeValue {
        public FloatsValue {
            values = List.copyOf(values);
        }

        @Override
        public AttributeType type() { return AttributeType.FLOATS; }

        @Override
        public String toText() {
            return values.toString();
        }
    }

    public record IntsValue(List<Long> values) implements AttributeValue {
        public IntsValue {
            values = List.copyOf(values);
        }

        @Override
        public AttributeType type() { return AttributeType.INTS; }

        @Override
        public String toText() {
            return values.toString();
        }
    }

    public record StringsValue(List<String> values) implements AttributeValue {
        public StringsValue {
            values = List.copyOf(values);
        }

        @Override
        public AttributeType type() { return AttributeType.STRINGS; }

        @Override
        public String toText() {
            return values.stream().map(v -> "\"" + v + "\"").collect(Collectors.joining(", ", "[", "]"));
        }
    }

    public record TensorsValue(List<TensorLiteral> values) implements AttributeValue {
        public TensorsValue {
            values = List.copyOf(values);
        }

        @Override
        public AttributeType type() { return AttributeType.TENSORS; }

        @Override
        public String toText() {
            return values.stream().map(TensorLiteral::toText).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    public record GraphsValue(List<Graph> values) implements AttributeValue {
        public GraphsValue {
            values = List.copyOf(values);
        }

        @Override
        public AttributeType type() { return AttributeType.GRAPHS; }

        @Override
        public String toText() {
            return values.stream().map(g -> "graph @" + g.name()).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    // ==================== Nodes ====================

    /**
     * A concrete graph node.
     *
     * <p>{@code name} may be empty. Attributes keep their insertion order.
     */
    public record Node(
            String name,
            String opType,
            List<String> inputs,
            List<String> outputs,
            Map<String, AttributeValue> attributes
    ) {
        public Node {
            name = name == null ? "" : name;
            Objects.requireNonNull(opType, "opType");
            inputs = List.copyOf(inputs);
            outputs = List.copyOf(outputs);
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        public Node(String opType, List<String> inputs, List<String> outputs) {
            this("", opType, inputs, outputs, Map.of());
        }

        public boolean hasName() {
            return !name.isEmpty();
        }

        public AttributeValue attribute(String attrName) {
            return attributes.get(attrName);
        }

        public String toText() {
            StringBuilder sb = new StringBuilder();
            sb.append(String.join(", ", outputs)).append(" = ").append(opType);
            if (!attributes.isEmpty()) {
                sb.append(attributes.entrySet().stream()
                        .map(e -> e.getKey() + " = " + e.getValue().toText())
                        .collect(Collectors.joining(", ", "<", ">")));
            }
            sb.append("(").append(String.join(", ", inputs)).append(")");
            return sb.toString();
        }
    }
}
