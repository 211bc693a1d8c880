package io.surfworks.templar.function;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.surfworks.templar.ir.Attributes;
import io.surfworks.templar.ir.GraphIr.AttributeValue;

/**
 * Input to {@link FunctionDefinitions#define}: the description of one body node.
 *
 * <p>Attributes given as text are resolved when the function is defined, so
 * {@code "$alpha:float"} becomes a forward reference. Attributes given as values
 * are always literals.
 *
 * <pre>{@code
 * NodeDef.of("LeakyRelu", List.of("X"), List.of("Y"))
 *     .attr("alpha", "$alpha:float");
 * }</pre>
 */
public final class NodeDef {

    /**
     * An attribute entry as written by the function author.
     */
    public sealed interface AttrDef permits Text, Value {}

    public record Text(String text) implements AttrDef {
        public Text {
            Objects.requireNonNull(text, "text");
        }
    }

    public record Value(AttributeValue value) implements AttrDef {
        public Value {
            Objects.requireNonNull(value, "value");
        }
    }

    private final String opType;
    private final List<String> inputs;
    private final List<String> outputs;
    private final Map<String, AttrDef> attributes;

    private NodeDef(String opType, List<String> inputs, List<String> outputs) {
        this.opType = Objects.requireNonNull(opType, "opType");
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.attributes = new LinkedHashMap<>();
    }

    public static NodeDef of(String opType, List<String> inputs, List<String> outputs) {
        return new NodeDef(opType, inputs, outputs);
    }

    /**
     * Adds a textual attribute: a {@code $name:type} reference or a literal string.
     */
    public NodeDef attr(String name, String text) {
        attributes.put(name, new Text(text));
        return this;
    }

    public NodeDef attr(String name, AttributeValue value) {
        attributes.put(name, new Value(value));
        return this;
    }

    public NodeDef attr(String name, float value) {
        return attr(name, Attributes.of(value));
    }

    public NodeDef attr(String name, long value) {
        return attr(name, Attributes.of(value));
    }

    public String opType() {
        return opType;
    }

    public List<String> inputs() {
        return inputs;
    }

    public List<String> outputs() {
        return outputs;
    }

    public Map<String, AttrDef> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public String toString() {
        return String.format("NodeDef[%s, inputs=%s, outputs=%s, attrs=%s]",
                opType, inputs, outputs, attributes.keySet());
    }
}
