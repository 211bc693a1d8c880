package io.surfworks.templar.json;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import io.surfworks.templar.function.AttributeSpec;
import io.surfworks.templar.function.FunctionDefinitions;
import io.surfworks.templar.function.FunctionTemplate;
import io.surfworks.templar.function.NodeDef;
import io.surfworks.templar.function.TemplateNode;
import io.surfworks.templar.ir.AttributeType;
import io.surfworks.templar.ir.Attributes;
import io.surfworks.templar.ir.Graph;
import io.surfworks.templar.ir.GraphIr.AttributeValue;
import io.surfworks.templar.ir.GraphIr.FloatValue;
import io.surfworks.templar.ir.GraphIr.FloatsValue;
import io.surfworks.templar.ir.GraphIr.GraphValue;
import io.surfworks.templar.ir.GraphIr.GraphsValue;
import io.surfworks.templar.ir.GraphIr.IntValue;
import io.surfworks.templar.ir.GraphIr.IntsValue;
import io.surfworks.templar.ir.GraphIr.Node;
import io.surfworks.templar.ir.GraphIr.StringValue;
import io.surfworks.templar.ir.GraphIr.StringsValue;
import io.surfworks.templar.ir.GraphIr.TensorLiteral;
import io.surfworks.templar.ir.GraphIr.TensorValue;
import io.surfworks.templar.ir.GraphIr.TensorsValue;

/**
 * JSON form of function definitions.
 *
 * <p>A function is an object:
 * <pre>{@code
 * {
 *   "name": "LeakyReluScaled",
 *   "since_version": 1,
 *   "inputs": ["X"],
 *   "outputs": ["Y"],
 *   "attributes": ["alpha"],
 *   "nodes": [
 *     {"op_type": "LeakyRelu", "inputs": ["X"], "outputs": ["t"],
 *      "attributes": {"alpha": "$alpha:float"}},
 *     {"op_type": "Scale", "inputs": ["t"], "outputs": ["Y"],
 *      "attributes": {"scale": 2.0}}
 *   ]
 * }
 * }</pre>
 *
 * <p>Node attribute values map as follows: strings go through the
 * {@code $name:type} reference syntax, integral numbers become {@code int},
 * other numbers {@code float}, arrays the matching list kind, and objects with a
 * {@code dims} member become tensors. Values the plain form cannot carry
 * unchanged (non-finite floats, empty lists other than {@code ints}, graphs, and
 * strings starting with {@code $}) are written as
 * {@code {"type": "floats", "value": []}}.
 */
public final class TemplateJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private TemplateJson() {}

    // ==================== Reading ====================

    /**
     * Parses a single function definition.
     *
     * @throws TemplateJsonException if the document is malformed
     * @throws io.surfworks.templar.function.UnknownAttributeTypeException if an attribute reference is invalid
     */
    public static FunctionTemplate parseTemplate(String json) {
        return readTemplate(asObject(parse(json), "function"));
    }

    /**
     * Parses a JSON array of function definitions.
     */
    public static List<FunctionTemplate> parseTemplates(String json) {
        JsonElement root = parse(json);
        if (!root.isJsonArray()) {
            throw new TemplateJsonException("Expected an array of functions");
        }
        return readTemplates(root.getAsJsonArray());
    }

    /**
     * Reads function definitions from a stream, either one object or an array.
     */
    public static List<FunctionTemplate> load(InputStream in) throws IOException {
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (root.isJsonArray()) {
                return readTemplates(root.getAsJsonArray());
            }
            return List.of(readTemplate(asObject(root, "function")));
        } catch (JsonParseException e) {
            throw new TemplateJsonException("Malformed function JSON: " + e.getMessage(), e);
        }
    }

    private static JsonElement parse(String json) {
        try {
            JsonElement root = JsonParser.parseString(json);
            if (root == null || root.isJsonNull()) {
                throw new TemplateJsonException("Empty function JSON");
            }
            return root;
        } catch (JsonParseException e) {
            throw new TemplateJsonException("Malformed function JSON: " + e.getMessage(), e);
        }
    }

    private static List<FunctionTemplate> readTemplates(JsonArray array) {
        List<FunctionTemplate> result = new ArrayList<>();
        for (JsonElement element : array) {
            result.add(readTemplate(asObject(element, "function")));
        }
        return result;
    }

    private static FunctionTemplate readTemplate(JsonObject obj) {
        String name = requireString(obj, "name");
        try {
            int sinceVersion = obj.has("since_version") ? requireNumber(obj.get("since_version"), "since_version").getAsInt() : 1;

            List<NodeDef> nodes = new ArrayList<>();
            for (JsonElement element : array(obj, "nodes")) {
                nodes.add(readNode(name, asObject(element, "node")));
            }

            return FunctionDefinitions.define(
                    name,
                    sinceVersion,
                    stringList(obj, "inputs"),
                    stringList(obj, "outputs"),
                    stringList(obj, "attributes"),
                    nodes);
        } catch (IllegalStateException | ClassCastException | UnsupportedOperationException | NumberFormatException e) {
            // Gson accessors report type mismatches with these
            throw new TemplateJsonException("Function " + name + ": malformed JSON: " + e.getMessage(), e);
        }
    }

    private static NodeDef readNode(String function, JsonObject obj) {
        NodeDef def = NodeDef.of(requireString(obj, "op_type"), stringList(obj, "inputs"), stringList(obj, "outputs"));
        if (obj.has("attributes")) {
            JsonObject attrs = asObject(obj.get("attributes"), "attributes");
            for (Map.Entry<String, JsonElement> entry : attrs.entrySet()) {
                JsonElement value = entry.getValue();
                if (isString(value)) {
                    def.attr(entry.getKey(), value.getAsString());
                } else {
                    def.attr(entry.getKey(), readValue(function, entry.getKey(), value));
                }
            }
        }
        return def;
    }

    /**
     * Reads a non-reference value. Strings here are always literal.
     */
    private static AttributeValue readValue(String function, String attr, JsonElement value) {
        if (value.isJsonPrimitive()) {
            JsonPrimitive p = value.getAsJsonPrimitive();
            if (p.isNumber()) {
                return isIntegral(p) ? Attributes.of(p.getAsLong()) : Attributes.of(p.getAsFloat());
            }
            if (p.isString()) {
                return Attributes.of(p.getAsString());
            }
        } else if (value.isJsonArray()) {
            return readList(function, attr, value.getAsJsonArray());
        } else if (value.isJsonObject()) {
            JsonObject obj = value.getAsJsonObject();
            if (obj.has("type")) {
                return readTyped(function, attr, obj);
            }
            if (obj.has("dims")) {
                return Attributes.of(readTensor(obj));
            }
        }
        throw new TemplateJsonException(String.format(
                "Function %s: unsupported value for attribute %s: %s", function, attr, value));
    }

    private static AttributeValue readList(String function, String attr, JsonArray array) {
        if (array.size() == 0) {
            return Attributes.ints(List.of());
        }
        JsonElement first = array.get(0);
        if (isString(first)) {
            return readTypedList(function, attr, AttributeType.STRINGS, array);
        }
        if (first.isJsonObject()) {
            return readTypedList(function, attr, AttributeType.TENSORS, array);
        }
        boolean integral = true;
        for (JsonElement e : array) {
            if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
                throw new TemplateJsonException(String.format(
                        "Function %s: mixed list for attribute %s: %s", function, attr, array));
            }
            integral &= isIntegral(e.getAsJsonPrimitive());
        }
        return readTypedList(function, attr, integral ? AttributeType.INTS : AttributeType.FLOATS, array);
    }

    /**
     * Reads the explicit form {@code {"type": "<tag>", "value": ...}} written for values
     * that the plain form cannot carry.
     */
    private static AttributeValue readTyped(String function, String attr, JsonObject obj) {
        String tag = requireString(obj, "type");
        AttributeType type = AttributeType.fromTag(tag).orElseThrow(() -> new TemplateJsonException(
                String.format("Function %s: unknown type '%s' for attribute %s", function, tag, attr)));
        JsonElement value = obj.get("value");
        if (value == null) {
            throw new TemplateJsonException(String.format(
                    "Function %s: typed attribute %s has no value", function, attr));
        }
        if (type.isRepeated()) {
            if (!value.isJsonArray()) {
                throw new TemplateJsonException(String.format(
                        "Function %s: attribute %s of type %s needs an array", function, attr, tag));
            }
            return readTypedList(function, attr, type, value.getAsJsonArray());
        }
        switch (type) {
            case FLOAT:
                return Attributes.of(readFloat(value));
            case INT:
                return Attributes.of(requireNumber(value, attr).getAsLong());
            case STRING:
                if (!isString(value)) {
                    throw new TemplateJsonException(String.format(
                            "Function %s: attribute %s of type string needs a string", function, attr));
                }
                return Attributes.of(value.getAsString());
            case TENSOR:
                return Attributes.of(readTensor(asObject(value, "tensor")));
            default:
                return Attributes.of(readGraph(function, asObject(value, "graph")));
        }
    }

    private static AttributeValue readTypedList(String function, String attr, AttributeType type, JsonArray array) {
        switch (type) {
            case FLOATS: {
                List<Float> floats = new ArrayList<>();
                array.forEach(e -> floats.add(readFloat(e)));
                return Attributes.floats(floats);
            }
            case INTS: {
                List<Long> ints = new ArrayList<>();
                array.forEach(e -> ints.add(requireNumber(e, attr).getAsLong()));
                return Attributes.ints(ints);
            }
            case STRINGS: {
                List<String> strings = new ArrayList<>();
                for (JsonElement e : array) {
                    if (!isString(e)) {
                        throw new TemplateJsonException(String.format(
                                "Function %s: mixed list for attribute %s: %s", function, attr, array));
                    }
                    strings.add(e.getAsString());
                }
                return Attributes.strings(strings);
            }
            case TENSORS: {
                List<TensorLiteral> tensors = new ArrayList<>();
                array.forEach(e -> tensors.add(readTensor(asObject(e, "tensor"))));
                return Attributes.tensors(tensors);
            }
            default: {
                List<Graph> graphs = new ArrayList<>();
                array.forEach(e -> graphs.add(readGraph(function, asObject(e, "graph"))));
                return Attributes.graphs(graphs);
            }
        }
    }

    private static TensorLiteral readTensor(JsonObject obj) {
        List<Long> dims = new ArrayList<>();
        array(obj, "dims").forEach(e -> dims.add(requireNumber(e, "dims").getAsLong()));
        List<Double> data = new ArrayList<>();
        array(obj, "data").forEach(e -> data.add(readDouble(e)));
        String name = obj.has("name") ? requireString(obj, "name") : "";
        String elementType = obj.has("element_type") ? requireString(obj, "element_type") : "float";
        TensorLiteral tensor = new TensorLiteral(name, elementType, dims, data);
        if (!data.isEmpty() && data.size() != tensor.elementCount()) {
            throw new TemplateJsonException(String.format(
                    "Tensor '%s' has %d values for dims %s", name, data.size(), dims));
        }
        return tensor;
    }

    private static Graph readGraph(String function, JsonObject obj) {
        Graph graph = new Graph(requireString(obj, "name"), stringList(obj, "inputs"), stringList(obj, "outputs"));
        for (JsonElement element : array(obj, "nodes")) {
            JsonObject n = asObject(element, "node");
            Map<String, AttributeValue> attrs = new LinkedHashMap<>();
            if (n.has("attributes")) {
                for (Map.Entry<String, JsonElement> entry : asObject(n.get("attributes"), "attributes").entrySet()) {
                    attrs.put(entry.getKey(), readValue(function, entry.getKey(), entry.getValue()));
                }
            }
            graph.append(new Node(
                    n.has("name") ? requireString(n, "name") : "",
                    requireString(n, "op_type"),
                    stringList(n, "inputs"),
                    stringList(n, "outputs"),
                    attrs));
        }
        return graph;
    }

    private static float readFloat(JsonElement e) {
        return (float) readDouble(e);
    }

    /**
     * Numbers, or one of the strings {@code NaN}, {@code Infinity} and {@code -Infinity}.
     */
    private static double readDouble(JsonElement e) {
        if (isString(e)) {
            switch (e.getAsString()) {
                case "NaN":
                    return Double.NaN;
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    throw new TemplateJsonException("Expected a number, got " + e);
            }
        }
        return requireNumber(e, "value").getAsDouble();
    }

    private static boolean isIntegral(JsonPrimitive p) {
        String text = p.getAsString();
        int start = text.startsWith("-") ? 1 : 0;
        if (start == text.length()) {
            return false;
        }
        for (int i = start; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isString(JsonElement e) {
        return e.isJsonPrimitive() && e.getAsJsonPrimitive().isString();
    }

    private static JsonPrimitive requireNumber(JsonElement e, String what) {
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            throw new TemplateJsonException("Expected a number for '" + what + "', got " + e);
        }
        return e.getAsJsonPrimitive();
    }

    /**
     * Returns the named array member, or an empty array when it is absent.
     */
    private static JsonArray array(JsonObject obj, String member) {
        JsonElement element = obj.get(member);
        if (element == null) {
            return new JsonArray();
        }
        if (!element.isJsonArray()) {
            throw new TemplateJsonException("Expected an array for '" + member + "', got " + element);
        }
        return element.getAsJsonArray();
    }

    private static List<String> stringList(JsonObject obj, String member) {
        List<String> result = new ArrayList<>();
        for (JsonElement e : array(obj, member)) {
            if (!isString(e)) {
                throw new TemplateJsonException("Expected only strings in '" + member + "', got " + e);
            }
            result.add(e.getAsString());
        }
        return result;
    }

    private static String requireString(JsonObject obj, String member) {
        JsonElement element = obj.get(member);
        if (element == null || !isString(element)) {
            throw new TemplateJsonException("Missing string member '" + member + "'");
        }
        return element.getAsString();
    }

    private static JsonObject asObject(JsonElement element, String what) {
        if (element == null || !element.isJsonObject()) {
            throw new TemplateJsonException("Expected a JSON object for " + what + ", got " + element);
        }
        return element.getAsJsonObject();
    }

    // ==================== Writing ====================

    public static String toJson(FunctionTemplate template) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", template.name());
        obj.addProperty("since_version", template.sinceVersion());
        obj.add("inputs", GSON.toJsonTree(template.formalInputs()));
        obj.add("outputs", GSON.toJsonTree(template.formalOutputs()));
        obj.add("attributes", GSON.toJsonTree(template.formalAttributes()));

        JsonArray nodes = new JsonArray();
        for (TemplateNode node : template.body()) {
            JsonObject n = new JsonObject();
            n.addProperty("op_type", node.opType());
            n.add("inputs", GSON.toJsonTree(node.inputRefs()));
            n.add("outputs", GSON.toJsonTree(node.outputRefs()));
            JsonObject attrs = new JsonObject();
            for (Map.Entry<String, AttributeSpec> entry : node.attributeSpecs().entrySet()) {
                AttributeSpec spec = entry.getValue();
                if (spec instanceof AttributeSpec.Forward forward) {
                    attrs.addProperty(entry.getKey(), forward.toString());
                } else {
                    attrs.add(entry.getKey(), writeValue(((AttributeSpec.Literal) spec).value()));
                }
            }
            if (attrs.size() > 0) {
                n.add("attributes", attrs);
            }
            nodes.add(n);
        }
        obj.add("nodes", nodes);
        return GSON.toJson(obj);
    }

    public static String toJson(Graph graph) {
        return GSON.toJson(writeGraph(graph));
    }

    private static JsonObject writeGraph(Graph graph) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", graph.name());
        obj.add("inputs", GSON.toJsonTree(graph.inputs()));
        obj.add("outputs", GSON.toJsonTree(graph.outputs()));
        JsonArray nodes = new JsonArray();
        for (Node node : graph.nodes()) {
            JsonObject n = new JsonObject();
            if (node.hasName()) {
                n.addProperty("name", node.name());
            }
            n.addProperty("op_type", node.opType());
            n.add("inputs", GSON.toJsonTree(node.inputs()));
            n.add("outputs", GSON.toJsonTree(node.outputs()));
            if (!node.attributes().isEmpty()) {
                JsonObject attrs = new JsonObject();
                node.attributes().forEach((k, v) -> attrs.add(k, writeValue(v)));
                n.add("attributes", attrs);
            }
            nodes.add(n);
        }
        obj.add("nodes", nodes);
        return obj;
    }

    /**
     * Writes a value in the plain form when reading it back gives the same value,
     * otherwise in the typed form.
     */
    private static JsonElement writeValue(AttributeValue value) {
        if (value instanceof FloatValue f) {
            return Float.isFinite(f.value()) ? new JsonPrimitive(f.value()) : typed(value, writeDouble(f.value()));
        } else if (value instanceof IntValue i) {
            return new JsonPrimitive(i.value());
        } else if (value instanceof StringValue s) {
            // a leading '$' would read back as a reference
            return s.value().startsWith("$") ? typed(value, new JsonPrimitive(s.value())) : new JsonPrimitive(s.value());
        } else if (value instanceof TensorValue t) {
            return writeTensor(t.value());
        } else if (value instanceof GraphValue g) {
            return typed(value, writeGraph(g.value()));
        } else if (value instanceof FloatsValue fs) {
            JsonArray array = new JsonArray();
            boolean plain = !fs.values().isEmpty();
            for (Float v : fs.values()) {
                array.add(Float.isFinite(v) ? new JsonPrimitive(v) : writeDouble(v));
                plain &= Float.isFinite(v);
            }
            return plain ? array : typed(value, array);
        } else if (value instanceof IntsValue is) {
            return GSON.toJsonTree(is.values());
        } else if (value instanceof StringsValue ss) {
            JsonArray array = GSON.toJsonTree(ss.values()).getAsJsonArray();
            return ss.values().isEmpty() ? typed(value, array) : array;
        } else if (value instanceof TensorsValue ts) {
            JsonArray array = new JsonArray();
            ts.values().forEach(t -> array.add(writeTensor(t)));
            return ts.values().isEmpty() ? typed(value, array) : array;
        } else {
            JsonArray array = new JsonArray();
            ((GraphsValue) value).values().forEach(g -> array.add(writeGraph(g)));
            return typed(value, array);
        }
    }

    private static JsonObject typed(AttributeValue value, JsonElement payload) {
        JsonObject obj = new JsonObject();
        obj.addProperty("type", value.type().tag());
        obj.add("value", payload);
        return obj;
    }

    private static JsonPrimitive writeDouble(double v) {
        if (Double.isNaN(v)) {
            return new JsonPrimitive("NaN");
        }
        if (Double.isInfinite(v)) {
            return new JsonPrimitive(v > 0 ? "Infinity" : "-Infinity");
        }
        return new JsonPrimitive(v);
    }

    private static JsonObject writeTensor(TensorLiteral tensor) {
        JsonObject obj = new JsonObject();
        if (!tensor.name().isEmpty()) {
            obj.addProperty("name", tensor.name());
        }
        obj.addProperty("element_type", tensor.elementType());
        obj.add("dims", GSON.toJsonTree(tensor.dims()));
        JsonArray data = new JsonArray();
        tensor.data().forEach(d -> data.add(writeDouble(d)));
        obj.add("data", data);
        return obj;
    }
}
