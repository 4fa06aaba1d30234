package de.conciso.circulargraph.service;

import de.conciso.circulargraph.exception.UnknownCircularException;
import de.conciso.circulargraph.model.DependencyNode;
import de.conciso.circulargraph.model.DependencyTrace;
import de.conciso.circulargraph.model.Identifier;
import de.conciso.circulargraph.model.KnownIndex;
import de.conciso.circulargraph.model.ReferenceGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tiefenbegrenzte Breitensuche über den Referenzgraphen.
 * <p>
 * Jeder Knoten wird genau einmal expandiert, und zwar beim ersten Erreichen.
 * Wird er später über einen anderen Pfad erneut erreicht, erscheint er auf
 * dieser Ebene noch einmal (als {@code revisit}), ohne seine Kinder erneut
 * aufzulisten. Knoten auf {@code maxDepth} werden erfasst, aber nicht
 * expandiert.
 */
@Service
public class DependencyTracer {

    public static final int DEFAULT_MAX_DEPTH = 5;

    private static final Logger log = LoggerFactory.getLogger(DependencyTracer.class);

    public DependencyTrace trace(Identifier start, ReferenceGraph graph, KnownIndex index) {
        return trace(start, graph, index, DEFAULT_MAX_DEPTH);
    }

    public DependencyTrace trace(Identifier start, ReferenceGraph graph, KnownIndex index, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        }
        if (!graph.contains(start) && !index.contains(start)) {
            throw new UnknownCircularException(start.value());
        }

        DependencyNode root = DependencyNode.root(start);
        List<DependencyNode> arrivals = new ArrayList<>();
        arrivals.add(root);

        Set<Identifier> visited = new HashSet<>();
        visited.add(start);
        Deque<DependencyNode> queue = new ArrayDeque<>();
        queue.add(root);

        while (!queue.isEmpty()) {
            DependencyNode current = queue.poll();
            if (current.depth() >= maxDepth) continue;

            for (Identifier child : graph.successors(current.identifier())) {
                boolean firstVisit = visited.add(child);
                DependencyNode arrival = new DependencyNode(child, current.depth() + 1,
                        current.identifier(), !firstVisit);
                arrivals.add(arrival);
                if (firstVisit) {
                    queue.add(arrival);
                }
            }
        }

        DependencyTrace trace = new DependencyTrace(start, maxDepth, arrivals);
        log.info("Traced {}: {} distinct dependencies over {} level(s), {} arrival(s)",
                start, trace.distinctDependencies().size(), trace.deepestLevel(), arrivals.size());
        return trace;
    }
}
