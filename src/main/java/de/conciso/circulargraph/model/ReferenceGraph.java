package de.conciso.circulargraph.model;

import de.conciso.circulargraph.model.ReferenceEdge.EdgeKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directed reference graph over one corpus scan. Read-only once built;
 * safe to share between concurrent trace requests.
 */
public final class ReferenceGraph {

    private final Map<Identifier, GraphNode> nodes;
    private final Map<EdgeKey, ReferenceEdge> edges;
    private final Map<Identifier, List<Identifier>> outgoing;
    private final Map<Identifier, Integer> incoming;
    private final Map<Identifier, List<ExternalReference>> externals;
    private final Map<ExternalReference, List<Identifier>> fuzzyMatches;
    private final List<SkippedDocument> skippedDocuments;
    private final GraphStatistics statistics;

    public ReferenceGraph(Map<Identifier, GraphNode> nodes,
                          Map<EdgeKey, ReferenceEdge> edges,
                          Map<Identifier, List<ExternalReference>> externals,
                          Map<ExternalReference, List<Identifier>> fuzzyMatches,
                          List<SkippedDocument> skippedDocuments,
                          GraphStatistics statistics) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
        this.skippedDocuments = List.copyOf(skippedDocuments);
        this.statistics = statistics;

        Map<Identifier, List<Identifier>> out = new LinkedHashMap<>();
        Map<Identifier, Integer> in = new LinkedHashMap<>();
        for (ReferenceEdge edge : this.edges.values()) {
            if (!this.nodes.containsKey(edge.from()) || !this.nodes.containsKey(edge.to())) {
                throw new IllegalArgumentException("edge endpoint missing from node set: " + edge.key());
            }
            out.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
            in.merge(edge.to(), 1, Integer::sum);
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);

        Map<Identifier, List<ExternalReference>> ext = new LinkedHashMap<>();
        externals.forEach((k, v) -> ext.put(k, List.copyOf(v)));
        this.externals = Collections.unmodifiableMap(ext);

        Map<ExternalReference, List<Identifier>> fuzzy = new LinkedHashMap<>();
        fuzzyMatches.forEach((k, v) -> {
            if (!v.isEmpty()) fuzzy.put(k, List.copyOf(v));
        });
        this.fuzzyMatches = Collections.unmodifiableMap(fuzzy);
    }

    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    public Optional<GraphNode> node(Identifier identifier) {
        return Optional.ofNullable(nodes.get(identifier));
    }

    public boolean contains(Identifier identifier) {
        return nodes.containsKey(identifier);
    }

    public Collection<ReferenceEdge> edges() {
        return edges.values();
    }

    public Optional<ReferenceEdge> edge(Identifier from, Identifier to) {
        return Optional.ofNullable(edges.get(new EdgeKey(from, to)));
    }

    /** Targets of {@code from} in extraction order; empty for unknown or unscanned nodes. */
    public List<Identifier> successors(Identifier from) {
        return outgoing.getOrDefault(from, List.of());
    }

    public int outDegree(Identifier identifier) {
        return successors(identifier).size();
    }

    public int inDegree(Identifier identifier) {
        return incoming.getOrDefault(identifier, 0);
    }

    /** An edge is internal when its target was itself scanned in this build. */
    public boolean isInternal(ReferenceEdge edge) {
        GraphNode target = nodes.get(edge.to());
        return target != null && target.scanned();
    }

    public Map<Identifier, List<ExternalReference>> externals() {
        return externals;
    }

    public List<ExternalReference> externalsOf(Identifier source) {
        return externals.getOrDefault(source, List.of());
    }

    /**
     * Index entries that loosely match an unresolved reference. Reporting only;
     * never backed by an edge.
     */
    public List<Identifier> fuzzyMatchesOf(ExternalReference reference) {
        return fuzzyMatches.getOrDefault(reference, List.of());
    }

    public List<SkippedDocument> skippedDocuments() {
        return skippedDocuments;
    }

    public GraphStatistics statistics() {
        return statistics;
    }
}
