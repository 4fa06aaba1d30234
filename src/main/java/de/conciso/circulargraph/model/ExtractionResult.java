package de.conciso.circulargraph.model;

import java.util.List;

public record ExtractionResult(
        Identifier source,
        List<ReferenceEdge> edges,
        List<ExternalReference> externals,
        List<String> malformedCandidates
) {
    public ExtractionResult {
        edges = List.copyOf(edges);
        externals = List.copyOf(externals);
        malformedCandidates = List.copyOf(malformedCandidates);
    }
}
