package io.surfworks.templar.inline;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.templar.expand.CallSite;
import io.surfworks.templar.expand.FunctionExpander;
import io.surfworks.templar.function.FunctionTemplate;
import io.surfworks.templar.ir.Graph;
import io.surfworks.templar.ir.GraphIr.Node;

/**
 * Replaces every call to a library function in a graph with the function's body.
 *
 * <p>The pass runs in rounds. Each round walks the graph once and expands every
 * node whose op type names a function available at the pass's opset version;
 * other nodes are copied as they are. Rounds repeat while the previous round
 * expanded something, so calls nested inside function bodies are inlined as
 * well.
 *
 * <pre>{@code
 * FunctionInliningPass pass = new FunctionInliningPass(library, 13);
 * Graph flat = pass.apply(graph);
 * System.out.println("Inlined: " + pass.lastInlinedCount());
 * }</pre>
 */
public final class FunctionInliningPass {

    private static final Logger LOG = Logger.getLogger(FunctionInliningPass.class.getName());

    public static final int DEFAULT_MAX_DEPTH = 16;

    private final FunctionLibrary library;
    private final FunctionExpander expander;
    private final int opsetVersion;
    private final int maxDepth;
    private int lastInlinedCount;

    public FunctionInliningPass(FunctionLibrary library, int opsetVersion) {
        this(library, new FunctionExpander(), opsetVersion,
                Integer.getInteger("templar.inline.maxDepth", DEFAULT_MAX_DEPTH));
    }

    /**
     * @param library the functions to inline
     * @param expander the expander used for each call
     * @param opsetVersion the opset version selecting function versions
     * @param maxDepth the maximum number of rounds; more are taken as recursion
     */
    public FunctionInliningPass(FunctionLibrary library, FunctionExpander expander, int opsetVersion, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.library = Objects.requireNonNull(library, "library");
        this.expander = Objects.requireNonNull(expander, "expander");
        this.opsetVersion = opsetVersion;
        this.maxDepth = maxDepth;
    }

    /**
     * Inlines all function calls.
     *
     * @param graph the graph to rewrite; it is not modified
     * @return a new graph with the same name and boundary and no function calls
     * @throws IllegalStateException if calls remain after {@code maxDepth} rounds
     * @throws io.surfworks.templar.expand.ArityException if a call has too many inputs or outputs
     */
    public Graph apply(Graph graph) {
        lastInlinedCount = 0;
        Graph current = graph;
        for (int round = 1; round <= maxDepth; round++) {
            Graph next = current.emptyCopy();
            int inlined = inlineOnce(current, next);
            if (inlined == 0) {
                return next;
            }
            lastInlinedCount += inlined;
            int r = round;
            LOG.fine(() -> String.format("%s: round %d inlined %d calls", graph.name(), r, inlined));
            current = next;
        }
        if (hasCalls(current)) {
            throw new IllegalStateException(String.format(
                    "Graph %s still has function calls after %d inlining rounds; recursive function?",
                    graph.name(), maxDepth));
        }
        return current;
    }

    private int inlineOnce(Graph source, Graph target) {
        int inlined = 0;
        for (Node node : source.nodes()) {
            Optional<FunctionTemplate> template = library.find(node.opType(), opsetVersion);
            if (template.isPresent()) {
                expander.expand(CallSite.of(node), template.get(), target);
                inlined++;
            } else {
                target.append(node);
            }
        }
        return inlined;
    }

    private boolean hasCalls(Graph graph) {
        for (Node node : graph.nodes()) {
            if (library.find(node.opType(), opsetVersion).isPresent()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the number of calls expanded by the last {@link #apply} call, over all rounds.
     */
    public int lastInlinedCount() {
        return lastInlinedCount;
    }

    @Override
    public String toString() {
        return String.format("FunctionInliningPass[opset=%d, maxDepth=%d, lastInlined=%d]",
                opsetVersion, maxDepth, lastInlinedCount);
    }
}
