package io.surfworks.templar.expand;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import io.surfworks.templar.expand.ArityException.Direction;
import io.surfworks.templar.function.AttributeSpec;
import io.surfworks.templar.function.FunctionTemplate;
import io.surfworks.templar.function.TemplateNode;
import io.surfworks.templar.ir.Graph;
import io.surfworks.templar.ir.GraphIr.AttributeValue;
import io.surfworks.templar.ir.GraphIr.Node;

/**
 * Inlines a function call into a graph.
 *
 * <p>For each body node the expander emits a concrete node in which
 * <ul>
 *   <li>formal inputs and outputs are replaced, by position, with the call
 *       site's actual names,</li>
 *   <li>every other tensor name is made local to the call by prefixing it with
 *       {@code internalPrefix + nodeName},</li>
 *   <li>forwarded attributes take the call site's value, or are dropped when the
 *       call site does not supply one.</li>
 * </ul>
 *
 * <p>Example:
 * <pre>{@code
 * // function Foo(A, B) -> (C) { C = Add(A, B) }
 * Node call = new Node("Foo", List.of("x", "y"), List.of("z"));
 * new FunctionExpander().expand(CallSite.of(call), foo, graph);
 * // graph now ends with: z = Add(x, y)
 * }</pre>
 *
 * <p>An expander holds no per-call state and may be shared between threads.
 */
public final class FunctionExpander {

    private static final Logger LOG = Logger.getLogger(FunctionExpander.class.getName());

    /** Starts every generated seed. Explicit node names starting with it are escaped by doubling. */
    static final char GENERATED_SEED_MARKER = '#';

    private final ExpansionConfig config;

    public FunctionExpander() {
        this(ExpansionConfig.defaults());
    }

    public FunctionExpander(ExpansionConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Expands a call and appends the resulting nodes to {@code target}.
     *
     * <p>The nodes are appended only after all of them have been built, so a failed
     * expansion leaves the target unchanged.
     *
     * @param callSite the call to expand
     * @param template the function being called
     * @param target the graph receiving the nodes
     * @return the appended nodes
     * @throws ArityException if the call site supplies more inputs or outputs than the function declares
     */
    public ExpansionResult expand(CallSite callSite, FunctionTemplate template, Graph target) {
        Objects.requireNonNull(target, "target");
        ExpansionResult result = instantiate(callSite, template);
        target.appendAll(result.nodes());
        LOG.fine(() -> String.format("Expanded %s as %s into %s: %d nodes",
                template.name(), result.nodeName(), target.name(), result.size()));
        return result;
    }

    /**
     * Builds the concrete nodes for a call without touching any graph.
     *
     * @throws ArityException if the call site supplies more inputs or outputs than the function declares
     */
    public ExpansionResult instantiate(CallSite callSite, FunctionTemplate template) {
        Objects.requireNonNull(callSite, "callSite");
        Objects.requireNonNull(template, "template");

        String nodeName = namingSeed(callSite, template);

        Map<String, String> inputMap = bindPositional(
                Direction.INPUT, nodeName, template.formalInputs(), callSite.actualInputs());
        Map<String, String> outputMap = bindPositional(
                Direction.OUTPUT, nodeName, template.formalOutputs(), callSite.actualOutputs());
        Map<String, AttributeValue> attrMap = callSite.actualAttributes();

        Renamer inputs = new Renamer(Direction.INPUT, nodeName, inputMap, template.formalInputs());
        Renamer outputs = new Renamer(Direction.OUTPUT, nodeName, outputMap, template.formalOutputs());

        List<Node> nodes = new ArrayList<>(template.body().size());
        for (TemplateNode bodyNode : template.body()) {
            nodes.add(new Node(
                    "",
                    bodyNode.opType(),
                    inputs.apply(bodyNode.inputRefs()),
                    outputs.apply(bodyNode.outputRefs()),
                    resolveAttributes(bodyNode, attrMap, nodeName)));
        }
        return new ExpansionResult(nodeName, nodes);
    }

    /**
     * Picks the hygiene seed for a call.
     *
     * <p>Generated seeds have the form {@code #<id>_<template>_}. The id is terminated by
     * {@code _}, so no generated seed is a prefix of another. An explicit node name is used
     * as is unless it starts with {@code #}, in which case a second {@code #} is prepended
     * so it can never read as a generated seed.
     */
    static String namingSeed(CallSite callSite, FunctionTemplate template) {
        return callSite.name()
                .map(name -> name.charAt(0) == GENERATED_SEED_MARKER ? GENERATED_SEED_MARKER + name : name)
                .orElseGet(() -> GENERATED_SEED_MARKER + callSite.id().toString() + "_" + template.name() + "_");
    }

    private static Map<String, String> bindPositional(
            Direction direction, String nodeName, List<String> formals, List<String> actuals) {
        if (actuals.size() > formals.size()) {
            throw new ArityException(direction, nodeName, formals.size(), actuals.size());
        }
        Map<String, String> bindings = new HashMap<>();
        for (int i = 0; i < actuals.size(); i++) {
            bindings.put(formals.get(i), actuals.get(i));
        }
        return bindings;
    }

    private static Map<String, AttributeValue> resolveAttributes(
            TemplateNode bodyNode, Map<String, AttributeValue> attrMap, String nodeName) {
        Map<String, AttributeValue> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, AttributeSpec> entry : bodyNode.attributeSpecs().entrySet()) {
            AttributeSpec spec = entry.getValue();
            if (spec instanceof AttributeSpec.Literal literal) {
                resolved.put(entry.getKey(), literal.value());
                continue;
            }
            String ref = ((AttributeSpec.Forward) spec).refAttrName();
            AttributeValue actual = attrMap.get(ref);
            if (actual != null) {
                resolved.put(entry.getKey(), actual);
            } else {
                LOG.fine(() -> String.format("%s: attribute %s of %s omitted, call site has no '%s'",
                        nodeName, entry.getKey(), bodyNode.opType(), ref));
            }
        }
        return resolved;
    }

    private String localName(String nodeName, String name) {
        return config.internalPrefix() + nodeName + name;
    }

    /**
     * Maps body references for one direction.
     */
    private final class Renamer {
        private final Direction direction;
        private final String nodeName;
        private final Map<String, String> bindings;
        private final List<String> formals;

        Renamer(Direction direction, String nodeName, Map<String, String> bindings, List<String> formals) {
            this.direction = direction;
            this.nodeName = nodeName;
            this.bindings = bindings;
            this.formals = formals;
        }

        List<String> apply(List<String> refs) {
            List<String> out = new ArrayList<>(refs.size());
            for (String ref : refs) {
                String bound = bindings.get(ref);
                if (bound != null) {
                    out.add(bound);
                    continue;
                }
                if (formals.contains(ref)) {
                    unboundFormal(ref);
                }
                out.add(localName(nodeName, ref));
            }
            return out;
        }

        private void unboundFormal(String ref) {
            if (config.strictFormalBinding()) {
                throw new ArityException(direction, nodeName, ref, formals.size(), bindings.size());
            }
            LOG.warning(() -> String.format(
                    "%s: formal %s '%s' has no actual argument, renaming it as a local tensor",
                    nodeName, direction.label(), ref));
        }
    }
}
