package io.surfworks.templar.function;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named, versioned function definition: formal parameters plus a body of
 * template nodes.
 *
 * <p>Templates are immutable and may be expanded concurrently. Use
 * {@link FunctionDefinitions#define} to build one.
 */
public record FunctionTemplate(
        String name,
        int sinceVersion,
        List<String> formalInputs,
        List<String> formalOutputs,
        List<String> formalAttributes,
        List<TemplateNode> body
) {
    public FunctionTemplate {
        Objects.requireNonNull(name, "name");
        formalInputs = List.copyOf(formalInputs);
        formalOutputs = List.copyOf(formalOutputs);
        formalAttributes = List.copyOf(formalAttributes);
        body = List.copyOf(body);
    }

    /**
     * Returns the formal attribute names referenced by the body, in first-use order.
     */
    public Set<String> forwardedAttributes() {
        Set<String> refs = new LinkedHashSet<>();
        for (TemplateNode node : body) {
            for (AttributeSpec spec : node.attributeSpecs().values()) {
                if (spec instanceof AttributeSpec.Forward forward) {
                    refs.add(forward.refAttrName());
                }
            }
        }
        return refs;
    }

    /**
     * Renders the function as {@code function @Name vN(ins) -> (outs) attrs [..] { ... }},
     * one body node per line.
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append("function @").append(name).append(" v").append(sinceVersion)
                .append("(").append(String.join(", ", formalInputs)).append(")")
                .append(" -> (").append(String.join(", ", formalOutputs)).append(")");
        if (!formalAttributes.isEmpty()) {
            sb.append(" attrs [").append(String.join(", ", formalAttributes)).append("]");
        }
        sb.append(" {\n");
        for (TemplateNode node : body) {
            sb.append("  ").append(node).append("\n");
        }
        sb.append("}");
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("FunctionTemplate[%s v%d, inputs=%d, outputs=%d, nodes=%d]",
                name, sinceVersion, formalInputs.size(), formalOutputs.size(), body.size());
    }
}
