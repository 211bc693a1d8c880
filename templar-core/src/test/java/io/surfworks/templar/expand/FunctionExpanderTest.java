package io.surfworks.templar.expand;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.surfworks.templar.function.FunctionDefinitions;
import io.surfworks.templar.function.FunctionTemplate;
import io.surfworks.templar.function.NodeDef;
import io.surfworks.templar.ir.Attributes;
import io.surfworks.templar.ir.Graph;
import io.surfworks.templar.ir.GraphIr.AttributeValue;
import io.surfworks.templar.ir.GraphIr.Node;
import io.surfworks.templar.ir.GraphIr.TensorLiteral;
import io.surfworks.templar.ir.GraphIr.TensorValue;

@DisplayName("Function expansion")
class FunctionExpanderTest {

    private static final ExpansionConfig CONFIG = new ExpansionConfig("Func_", false);

    private final FunctionExpander expander = new FunctionExpander(CONFIG);

    /** Foo(A, B) -> (C) { C = Add(A, B) } */
    private static FunctionTemplate foo() {
        return FunctionDefinitions.define("Foo", 1,
                List.of("A", "B"), List.of("C"), List.of(),
                List.of(NodeDef.of("Add", List.of("A", "B"), List.of("C"))));
    }

    /** Twice(X) -> (Y) { tmp = Relu(X); Y = Add(tmp, tmp) } */
    private static FunctionTemplate twice() {
        return FunctionDefinitions.define("Twice", 1,
                List.of("X"), List.of("Y"), List.of(),
                List.of(
                        NodeDef.of("Relu", List.of("X"), List.of("tmp")),
                        NodeDef.of("Add", List.of("tmp", "tmp"), List.of("Y"))));
    }

    /** Leaky(X) -> (Y) { Y = LeakyRelu<alpha = $alpha, mode = "fast">(X) } */
    private static FunctionTemplate leaky() {
        return FunctionDefinitions.define("Leaky", 1,
                List.of("X"), List.of("Y"), List.of("alpha"),
                List.of(NodeDef.of("LeakyRelu", List.of("X"), List.of("Y"))
                        .attr("alpha", "$alpha:float")
                        .attr("mode", "fast")));
    }

    private static CallSite call(String name, String op, List<String> inputs, List<String> outputs) {
        return new CallSite(CallSiteId.next(), name, op, inputs, outputs, Map.of());
    }

    private static CallSite call(String op, List<String> inputs, List<String> outputs,
                                 Map<String, AttributeValue> attrs) {
        return CallSite.of(op, inputs, outputs, attrs);
    }

    @Nested
    @DisplayName("positional binding")
    class Binding {

        @Test
        @DisplayName("Foo(x, y) -> z expands to z = Add(x, y)")
        void expandsSingleNodeFunction() {
            Graph graph = new Graph("main");

            ExpansionResult result = expander.expand(
                    call("foo_0", "Foo", List.of("x", "y"), List.of("z")), foo(), graph);

            assertEquals(1, graph.size());
            Node node = graph.nodes().get(0);
            assertEquals("Add", node.opType());
            assertEquals(List.of("x", "y"), node.inputs());
            assertEquals(List.of("z"), node.outputs());
            assertEquals(result.nodes(), graph.nodes());
        }

        @Test
        void everyOccurrenceOfFormalIsReplaced() {
            FunctionTemplate square = FunctionDefinitions.define("Square", 1,
                    List.of("X"), List.of("Y"), List.of(),
                    List.of(
                            NodeDef.of("Mul", List.of("X", "X"), List.of("sq")),
                            NodeDef.of("Add", List.of("sq", "X"), List.of("Y"))));

            ExpansionResult result = expander.instantiate(
                    call("s", "Square", List.of("input_7"), List.of("out")), square);

            assertEquals(List.of("input_7", "input_7"), result.nodes().get(0).inputs());
            assertEquals(List.of("Func_ssq", "input_7"), result.nodes().get(1).inputs());
            assertEquals(List.of("out"), result.nodes().get(1).outputs());
        }

        @Test
        void appendsAfterExistingNodes() {
            Graph graph = new Graph("main");
            Node existing = new Node("Const", List.of(), List.of("x"));
            graph.append(existing);

            expander.expand(call("f", "Foo", List.of("x", "y"), List.of("z")), foo(), graph);

            assertEquals(2, graph.size());
            assertSame(existing, graph.nodes().get(0));
        }
    }

    @Nested
    @DisplayName("arity")
    class Arity {

        @Test
        void tooManyInputsFails() {
            Graph graph = new Graph("main");

            ArityException e = assertThrows(ArityException.class, () -> expander.expand(
                    call("f", "Foo", List.of("x", "y", "w"), List.of("z")), foo(), graph));

            assertEquals(ArityException.Direction.INPUT, e.getDirection());
            assertEquals(2, e.getFormalCount());
            assertEquals(3, e.getActualCount());
            assertEquals("f", e.getNodeName());
            assertEquals(0, graph.size());
        }

        @Test
        void tooManyOutputsFails() {
            ArityException e = assertThrows(ArityException.class, () -> expander.instantiate(
                    call("f", "Foo", List.of("x", "y"), List.of("z", "extra")), foo()));

            assertEquals(ArityException.Direction.OUTPUT, e.getDirection());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 2})
        void atMostFormalCountSucceeds(int actualInputs) {
            List<String> inputs = List.of("x", "y").subList(0, actualInputs);

            ExpansionResult result = expander.instantiate(
                    call("f", "Foo", inputs, List.of("z")), foo());

            assertEquals(1, result.size());
        }

        @Test
        void failureLeavesTargetUntouched() {
            FunctionTemplate twoNodes = twice();
            Graph graph = new Graph("main");
            graph.append(new Node("Const", List.of(), List.of("x")));

            assertThrows(ArityException.class, () -> expander.expand(
                    call("t", "Twice", List.of("x"), List.of("y", "z")), twoNodes, graph));

            assertEquals(1, graph.size());
        }

        @Test
        void unboundFormalFallsThroughToLocalName() {
            ExpansionResult result = expander.instantiate(
                    call("f", "Foo", List.of("x"), List.of("z")), foo());

            assertEquals(List.of("x", "Func_fB"), result.nodes().get(0).inputs());
        }

        @Test
        void strictModeRejectsUnboundFormal() {
            FunctionExpander strict = new FunctionExpander(CONFIG.withStrictFormalBinding(true));

            ArityException e = assertThrows(ArityException.class, () -> strict.instantiate(
                    call("f", "Foo", List.of("x"), List.of("z")), foo()));

            assertEquals(ArityException.Direction.INPUT, e.getDirection());
            assertTrue(e.getMessage().contains("'B'"));
            assertTrue(e.getMessage().contains("1 actual, 2 formal"));
            assertEquals(1, e.getActualCount());
        }
    }

    @Nested
    @DisplayName("hygiene")
    class Hygiene {

        @Test
        void localNameUsesNodeNameSeed() {
            ExpansionResult result = expander.instantiate(
                    call("n1", "Twice", List.of("a"), List.of("b")), twice());

            assertEquals("n1", result.nodeName());
            assertEquals(List.of("Func_n1tmp"), result.nodes().get(0).outputs());
            assertEquals(List.of("Func_n1tmp", "Func_n1tmp"), result.nodes().get(1).inputs());
        }

        @Test
        void unnamedCallSitesGetDistinctLocals() {
            Graph graph = new Graph("main");
            FunctionTemplate fn = twice();

            ExpansionResult first = expander.expand(
                    call("Twice", List.of("a"), List.of("b"), Map.of()), fn, graph);
            ExpansionResult second = expander.expand(
                    call("Twice", List.of("b"), List.of("c"), Map.of()), fn, graph);

            String firstLocal = first.nodes().get(0).outputs().get(0);
            String secondLocal = second.nodes().get(0).outputs().get(0);
            assertNotEquals(firstLocal, secondLocal);
            assertNotEquals("tmp", firstLocal);
            assertNotEquals("tmp", secondLocal);
            assertTrue(first.nodeName().startsWith("#"));
            assertTrue(first.nodeName().endsWith("_Twice_"));
        }

        /** T(X) -> (Y) { local = Relu(X); Y = Identity(local) }, with the local name given */
        private FunctionTemplate withLocal(String local) {
            return FunctionDefinitions.define("T", 1,
                    List.of("X"), List.of("Y"), List.of(),
                    List.of(
                            NodeDef.of("Relu", List.of("X"), List.of(local)),
                            NodeDef.of("Identity", List.of(local), List.of("Y"))));
        }

        private String firstLocal(CallSite site, FunctionTemplate fn) {
            return expander.instantiate(site, fn).nodes().get(0).outputs().get(0);
        }

        @Test
        void generatedSeedsAreNotPrefixesOfEachOther() {
            String id1 = firstLocal(new CallSite(new CallSiteId(1), "", "T",
                    List.of("a"), List.of("b"), Map.of()), withLocal("13"));
            String id11 = firstLocal(new CallSite(new CallSiteId(11), "", "T",
                    List.of("a"), List.of("b"), Map.of()), withLocal("3"));

            assertNotEquals(id1, id11);
        }

        @Test
        void generatedSeedDiffersFromLookalikeNodeName() {
            FunctionTemplate fn = withLocal("tmp");
            String unnamed = firstLocal(new CallSite(new CallSiteId(7), "", "T",
                    List.of("a"), List.of("b"), Map.of()), fn);

            for (String name : List.of("T_7", "#7_T_", "7_T_")) {
                String named = firstLocal(new CallSite(new CallSiteId(8), name, "T",
                        List.of("a"), List.of("b"), Map.of()), fn);
                assertNotEquals(unnamed, named, name);
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"#x", "#7_T_", "##"})
        void explicitNameWithMarkerIsEscaped(String name) {
            assertEquals("#" + name, FunctionExpander.namingSeed(
                    call(name, "T", List.of(), List.of()), withLocal("tmp")));
        }

        @Test
        void plainExplicitNameIsUsedAsIs() {
            assertEquals("T_7", FunctionExpander.namingSeed(
                    call("T_7", "T", List.of(), List.of()), withLocal("tmp")));
        }

        @Test
        void noTwoNodesWriteTheSameTensor() {
            Graph graph = new Graph("main");
            FunctionTemplate fn = twice();
            for (int i = 0; i < 10; i++) {
                expander.expand(call("Twice", List.of("in" + i), List.of("out" + i), Map.of()), fn, graph);
            }

            Set<String> written = new HashSet<>();
            for (Node node : graph.nodes()) {
                for (String output : node.outputs()) {
                    assertTrue(written.add(output), "tensor written twice: " + output);
                }
            }
            assertEquals(20, written.size());
        }

        @Test
        void configuredPrefixIsUsed() {
            FunctionExpander custom = new FunctionExpander(new ExpansionConfig("inl/", false));

            ExpansionResult result = custom.instantiate(
                    call("n", "Twice", List.of("a"), List.of("b")), twice());

            assertEquals(List.of("inl/ntmp"), result.nodes().get(0).outputs());
        }
    }

    @Nested
    @DisplayName("attributes")
    class AttributeResolution {

        @Test
        void forwardedAttributeTakesCallSiteValue() {
            ExpansionResult result = expander.instantiate(
                    call("Leaky", List.of("x"), List.of("y"), Map.of("alpha", Attributes.of(0.5f))), leaky());

            assertEquals(Attributes.of(0.5f), result.nodes().get(0).attribute("alpha"));
        }

        @Test
        void missingForwardedAttributeIsOmitted() {
            ExpansionResult result = expander.instantiate(
                    call("Leaky", List.of("x"), List.of("y"), Map.of()), leaky());

            Node node = result.nodes().get(0);
            assertFalse(node.attributes().containsKey("alpha"));
            assertEquals(Set.of("mode"), node.attributes().keySet());
        }

        @Test
        void literalIsCopiedUnchanged() {
            TensorLiteral weights = new TensorLiteral("w", "float", List.of(2L), List.of(1.0, 2.0));
            FunctionTemplate fn = FunctionDefinitions.define("Weighted", 1,
                    List.of("X"), List.of("Y"), List.of("mode"),
                    List.of(NodeDef.of("Mul", List.of("X"), List.of("Y"))
                            .attr("weights", Attributes.of(weights))
                            .attr("mode", "plain")));

            ExpansionResult result = expander.instantiate(
                    call("Weighted", List.of("x"), List.of("y"),
                            Map.of("mode", Attributes.of("other"), "weights", Attributes.of(1L))), fn);

            Node node = result.nodes().get(0);
            assertSame(weights, ((TensorValue) node.attribute("weights")).value());
            assertEquals(Attributes.of("plain"), node.attribute("mode"));
        }

        @Test
        void callSiteValueIsNotTypeChecked() {
            ExpansionResult result = expander.instantiate(
                    call("Leaky", List.of("x"), List.of("y"), Map.of("alpha", Attributes.ints(1, 2))), leaky());

            assertEquals(Attributes.ints(1, 2), result.nodes().get(0).attribute("alpha"));
        }

        @Test
        void unrelatedCallSiteAttributesAreIgnored() {
            ExpansionResult result = expander.instantiate(
                    call("Leaky", List.of("x"), List.of("y"),
                            Map.of("alpha", Attributes.of(0.1f), "beta", Attributes.of(2L))), leaky());

            assertEquals(Set.of("alpha", "mode"), result.nodes().get(0).attributes().keySet());
        }
    }

    @Test
    void callSiteFromGraphNode() {
        Node node = new Node("foo_call", "Foo", List.of("p", "q"), List.of("r"), Map.of());

        CallSite site = CallSite.of(node);

        assertEquals("foo_call", site.nodeName());
        assertEquals(List.of("p", "q"), site.actualInputs());
        assertNotEquals(CallSite.of(node).id(), site.id());
    }
}
