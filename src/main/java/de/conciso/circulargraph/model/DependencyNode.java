package de.conciso.circulargraph.model;

/**
 * One arrival of the traversal at a node. {@code discoveredVia} is null for
 * the start node. {@code revisit} marks an arrival at a node that had already
 * been reached earlier, so its children are not listed again.
 */
public record DependencyNode(
        Identifier identifier,
        int depth,
        Identifier discoveredVia,
        boolean revisit
) {
    public static DependencyNode root(Identifier start) {
        return new DependencyNode(start, 0, null, false);
    }
}
