package io.surfworks.templar.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import io.surfworks.templar.ir.GraphIr.AttributeValue;
import io.surfworks.templar.ir.GraphIr.FloatValue;
import io.surfworks.templar.ir.GraphIr.FloatsValue;
import io.surfworks.templar.ir.GraphIr.GraphValue;
import io.surfworks.templar.ir.GraphIr.GraphsValue;
import io.surfworks.templar.ir.GraphIr.IntValue;
import io.surfworks.templar.ir.GraphIr.IntsValue;
import io.surfworks.templar.ir.GraphIr.StringValue;
import io.surfworks.templar.ir.GraphIr.StringsValue;
import io.surfworks.templar.ir.GraphIr.TensorLiteral;
import io.surfworks.templar.ir.GraphIr.TensorValue;
import io.surfworks.templar.ir.GraphIr.TensorsValue;

/**
 * Factory methods that wrap primitive, string, tensor and graph values into
 * {@link AttributeValue}s.
 *
 * <pre>{@code
 * Map<String, AttributeValue> attrs = Map.of(
 *     "alpha", Attributes.of(0.5f),
 *     "axes", Attributes.ints(0, 1));
 * }</pre>
 */
public final class Attributes {

    private Attributes() {}

    public static AttributeValue of(float value) {
        return new FloatValue(value);
    }

    public static AttributeValue of(long value) {
        return new IntValue(value);
    }

    public static AttributeValue of(String value) {
        return new StringValue(value);
    }

    public static AttributeValue of(TensorLiteral value) {
        return new TensorValue(value);
    }

    public static AttributeValue of(Graph value) {
        return new GraphValue(value);
    }

    public static AttributeValue floats(float... values) {
        List<Float> boxed = new ArrayList<>(values.length);
        for (float v : values) {
            boxed.add(v);
        }
        return new FloatsValue(boxed);
    }

    public static AttributeValue floats(List<Float> values) {
        return new FloatsValue(values);
    }

    public static AttributeValue ints(long... values) {
        return new IntsValue(Arrays.stream(values).boxed().toList());
    }

    public static AttributeValue ints(List<Long> values) {
        return new IntsValue(values);
    }

    public static AttributeValue strings(String... values) {
        return new StringsValue(List.of(values));
    }

    public static AttributeValue strings(List<String> values) {
        return new StringsValue(values);
    }

    public static AttributeValue tensors(List<TensorLiteral> values) {
        return new TensorsValue(values);
    }

    public static AttributeValue graphs(List<Graph> values) {
        return new GraphsValue(values);
    }
}
