package de.conciso.circulargraph.model;

import java.util.List;

public record GraphStatistics(
        int totalNodes,
        int totalEdges,
        int internalEdges,
        int externalToCorpusEdges,
        int unscannedNodes,
        int unresolvedReferences,
        int fuzzyMatchedReferences,
        int malformedCandidates,
        int documentsTotal,
        int documentsScanned,
        int documentsSkipped,
        double avgReferencesPerDocument,
        double density,
        double averageDegree,
        int maxDegree,
        int minDegree,
        boolean acyclic,
        int weaklyConnectedComponents,
        int stronglyConnectedComponents,
        List<RankedCircular> mostReferenced,
        List<RankedCircular> mostOutgoing
) {
    public GraphStatistics {
        mostReferenced = List.copyOf(mostReferenced);
        mostOutgoing = List.copyOf(mostOutgoing);
    }

    public record RankedCircular(Identifier identifier, int count) {}
}
