package info.isaksson.erland.swanmodel.diagram;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Multi hop walks over a {@link DiagramGraph}, breadth first in wire order.
 *
 * <p>The caller owns the visited set: vertices already in it are neither reported nor
 * expanded, and every reported vertex is added to it. Passing the same set to several walks
 * shares that bookkeeping.</p>
 */
public final class DiagramTraversal {

    private DiagramTraversal() {
    }

    /** Vertices reachable from {@code start} following wires forward, start excluded. */
    public static List<DiagramVertex> downstream(DiagramGraph graph, DiagramVertex start, Set<DiagramVertex> visited) {
        return walk(graph, start, visited, true);
    }

    /** Vertices reaching {@code start} following wires backward, start excluded. */
    public static List<DiagramVertex> upstream(DiagramGraph graph, DiagramVertex start, Set<DiagramVertex> visited) {
        return walk(graph, start, visited, false);
    }

    private static List<DiagramVertex> walk(DiagramGraph graph, DiagramVertex start, Set<DiagramVertex> visited,
                                            boolean forward) {
        if (graph == null) throw new IllegalArgumentException("graph is null");
        if (visited == null) throw new IllegalArgumentException("visited is null");
        List<DiagramVertex> out = new ArrayList<>();
        Deque<DiagramVertex> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            DiagramVertex v = queue.poll();
            List<Endpoint> next = forward ? graph.targets(v) : graph.sources(v);
            for (Endpoint e : next) {
                if (visited.add(e.vertex())) {
                    out.add(e.vertex());
                    queue.add(e.vertex());
                }
            }
        }
        return out;
    }
}
