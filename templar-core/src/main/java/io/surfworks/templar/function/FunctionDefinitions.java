package io.surfworks.templar.function;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds {@link FunctionTemplate}s.
 *
 * <p>Example, a function computing {@code Y = X * scale + bias} with a forwarded
 * attribute:
 * <pre>{@code
 * FunctionTemplate scaleShift = FunctionDefinitions.define(
 *     "ScaleShift", 1,
 *     List.of("X", "B"), List.of("Y"), List.of("scale"),
 *     List.of(
 *         NodeDef.of("Scale", List.of("X"), List.of("scaled")).attr("scale", "$scale:float"),
 *         NodeDef.of("Add", List.of("scaled", "B"), List.of("Y"))));
 * }</pre>
 *
 * <p>Only the formal lists are checked. References inside the body are not
 * validated; a local name nobody produces is the function author's problem.
 */
public final class FunctionDefinitions {

    private static final Logger LOG = Logger.getLogger(FunctionDefinitions.class.getName());

    private FunctionDefinitions() {}

    /**
     * Defines a function.
     *
     * @param name the function name, also the op type call sites use
     * @param sinceVersion the first opset version that has this function
     * @param inputs formal input names, in positional order
     * @param outputs formal output names, in positional order
     * @param attributes formal attribute names available for forwarding
     * @param nodeDefs the body, in order
     * @return the immutable template
     * @throws UnknownAttributeTypeException if a body attribute reference has an unknown type tag
     * @throws IllegalArgumentException if a formal list contains the same name twice
     */
    public static FunctionTemplate define(
            String name,
            int sinceVersion,
            List<String> inputs,
            List<String> outputs,
            List<String> attributes,
            List<NodeDef> nodeDefs) {

        requireUnique(name, "input", inputs);
        requireUnique(name, "output", outputs);
        requireUnique(name, "attribute", attributes);

        List<TemplateNode> body = new ArrayList<>(nodeDefs.size());
        for (NodeDef def : nodeDefs) {
            body.add(toTemplateNode(def));
        }

        FunctionTemplate template = new FunctionTemplate(name, sinceVersion, inputs, outputs, attributes, body);
        LOG.fine(() -> "Defined " + template);
        return template;
    }

    private static TemplateNode toTemplateNode(NodeDef def) {
        Map<String, AttributeSpec> specs = new LinkedHashMap<>();
        for (Map.Entry<String, NodeDef.AttrDef> entry : def.attributes().entrySet()) {
            specs.put(entry.getKey(), toSpec(entry.getValue()));
        }
        return new TemplateNode(def.opType(), def.inputs(), def.outputs(), specs);
    }

    private static AttributeSpec toSpec(NodeDef.AttrDef attr) {
        if (attr instanceof NodeDef.Text text) {
            return AttributeRefs.resolve(text.text());
        }
        return new AttributeSpec.Literal(((NodeDef.Value) attr).value());
    }

    private static void requireUnique(String function, String kind, List<String> names) {
        Set<String> seen = new HashSet<>();
        for (String n : names) {
            if (!seen.add(n)) {
                throw new IllegalArgumentException(String.format(
                        "Function %s declares formal %s '%s' more than once", function, kind, n));
            }
        }
    }
}
