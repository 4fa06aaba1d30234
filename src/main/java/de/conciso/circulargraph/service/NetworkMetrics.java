package de.conciso.circulargraph.service;

import de.conciso.circulargraph.model.Identifier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Strukturkennzahlen über die Adjazenzliste: Dichte, Grad, Zyklenfreiheit
 * und Zusammenhangskomponenten. Grad = Eingangs- plus Ausgangsgrad.
 */
record NetworkMetrics(
        double density,
        double averageDegree,
        int maxDegree,
        int minDegree,
        boolean acyclic,
        int weaklyConnectedComponents,
        int stronglyConnectedComponents
) {

    static NetworkMetrics of(Collection<Identifier> nodes, Map<Identifier, List<Identifier>> outgoing) {
        int n = nodes.size();
        int e = outgoing.values().stream().mapToInt(List::size).sum();
        if (n == 0) {
            return new NetworkMetrics(0.0, 0.0, 0, 0, true, 0, 0);
        }

        Map<Identifier, List<Identifier>> incoming = reverse(nodes, outgoing);
        int max = Integer.MIN_VALUE;
        int min = Integer.MAX_VALUE;
        for (Identifier node : nodes) {
            int degree = successors(outgoing, node).size() + successors(incoming, node).size();
            max = Math.max(max, degree);
            min = Math.min(min, degree);
        }

        double density = n < 2 ? 0.0 : round((double) e / ((long) n * (n - 1)), 10_000);
        double avgDegree = round(2.0 * e / n, 100);

        return new NetworkMetrics(density, avgDegree, max, min,
                isAcyclic(nodes, outgoing, incoming),
                weaklyConnected(nodes, outgoing, incoming),
                stronglyConnected(nodes, outgoing, incoming));
    }

    // Kahn: zyklenfrei, wenn alle Knoten abgebaut werden
    private static boolean isAcyclic(Collection<Identifier> nodes,
                                     Map<Identifier, List<Identifier>> outgoing,
                                     Map<Identifier, List<Identifier>> incoming) {
        Map<Identifier, Integer> remaining = new HashMap<>();
        Deque<Identifier> ready = new ArrayDeque<>();
        for (Identifier node : nodes) {
            int in = successors(incoming, node).size();
            remaining.put(node, in);
            if (in == 0) ready.add(node);
        }
        int removed = 0;
        while (!ready.isEmpty()) {
            Identifier node = ready.poll();
            removed++;
            for (Identifier next : successors(outgoing, node)) {
                if (remaining.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return removed == nodes.size();
    }

    private static int weaklyConnected(Collection<Identifier> nodes,
                                       Map<Identifier, List<Identifier>> outgoing,
                                       Map<Identifier, List<Identifier>> incoming) {
        Set<Identifier> seen = new HashSet<>();
        int components = 0;
        for (Identifier node : nodes) {
            if (!seen.add(node)) continue;
            components++;
            Deque<Identifier> queue = new ArrayDeque<>();
            queue.add(node);
            while (!queue.isEmpty()) {
                Identifier current = queue.poll();
                for (Identifier next : successors(outgoing, current)) {
                    if (seen.add(next)) queue.add(next);
                }
                for (Identifier next : successors(incoming, current)) {
                    if (seen.add(next)) queue.add(next);
                }
            }
        }
        return components;
    }

    // Kosaraju, iterativ: erst Abschlussreihenfolge, dann Suche im umgekehrten Graphen
    private static int stronglyConnected(Collection<Identifier> nodes,
                                         Map<Identifier, List<Identifier>> outgoing,
                                         Map<Identifier, List<Identifier>> incoming) {
        Deque<Identifier> finished = new ArrayDeque<>();
        Set<Identifier> seen = new HashSet<>();
        for (Identifier root : nodes) {
            if (!seen.add(root)) continue;
            Deque<Identifier> path = new ArrayDeque<>();
            Deque<Iterator<Identifier>> pending = new ArrayDeque<>();
            path.push(root);
            pending.push(successors(outgoing, root).iterator());
            while (!pending.isEmpty()) {
                Iterator<Identifier> it = pending.peek();
                if (it.hasNext()) {
                    Identifier next = it.next();
                    if (seen.add(next)) {
                        path.push(next);
                        pending.push(successors(outgoing, next).iterator());
                    }
                } else {
                    pending.pop();
                    finished.push(path.pop());
                }
            }
        }

        Set<Identifier> assigned = new HashSet<>();
        int components = 0;
        for (Identifier root : finished) {
            if (!assigned.add(root)) continue;
            components++;
            Deque<Identifier> queue = new ArrayDeque<>();
            queue.add(root);
            while (!queue.isEmpty()) {
                for (Identifier next : successors(incoming, queue.poll())) {
                    if (assigned.add(next)) queue.add(next);
                }
            }
        }
        return components;
    }

    private static Map<Identifier, List<Identifier>> reverse(Collection<Identifier> nodes,
                                                             Map<Identifier, List<Identifier>> outgoing) {
        Map<Identifier, List<Identifier>> incoming = new LinkedHashMap<>();
        for (Identifier node : nodes) {
            for (Identifier next : successors(outgoing, node)) {
                incoming.computeIfAbsent(next, k -> new ArrayList<>()).add(node);
            }
        }
        return incoming;
    }

    private static List<Identifier> successors(Map<Identifier, List<Identifier>> adjacency, Identifier node) {
        return adjacency.getOrDefault(node, List.of());
    }

    private static double round(double value, int scale) {
        return Math.round(value * scale) / (double) scale;
    }
}
