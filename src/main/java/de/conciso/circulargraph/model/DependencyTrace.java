package de.conciso.circulargraph.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of one traversal: every arrival in BFS order, depth-0 start first.
 */
public record DependencyTrace(
        Identifier start,
        int maxDepth,
        List<DependencyNode> nodes
) {
    public DependencyTrace {
        nodes = List.copyOf(nodes);
    }

    /** Arrivals grouped by depth, ascending. */
    public Map<Integer, List<DependencyNode>> levels() {
        Map<Integer, List<DependencyNode>> levels = new LinkedHashMap<>();
        for (DependencyNode node : nodes) {
            levels.computeIfAbsent(node.depth(), d -> new ArrayList<>()).add(node);
        }
        return levels;
    }

    /** Distinct identifiers per depth; a node may be listed at more than one depth. */
    public Map<Integer, Set<Identifier>> identifiersByLevel() {
        Map<Integer, Set<Identifier>> levels = new LinkedHashMap<>();
        for (DependencyNode node : nodes) {
            levels.computeIfAbsent(node.depth(), d -> new LinkedHashSet<>()).add(node.identifier());
        }
        return levels;
    }

    /** Arrivals whose parent is {@code parent} and that sit one level below {@code parentDepth}. */
    public List<DependencyNode> childrenOf(Identifier parent, int parentDepth) {
        return nodes.stream()
                .filter(n -> parent.equals(n.discoveredVia()) && n.depth() == parentDepth + 1)
                .toList();
    }

    public int deepestLevel() {
        return nodes.stream().mapToInt(DependencyNode::depth).max().orElse(0);
    }

    public Set<Identifier> distinctDependencies() {
        Set<Identifier> ids = new LinkedHashSet<>();
        nodes.stream().filter(n -> n.depth() > 0).forEach(n -> ids.add(n.identifier()));
        ids.remove(start);
        return ids;
    }
}
