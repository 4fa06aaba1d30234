package de.conciso.circulargraph.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.conciso.circulargraph.model.ExternalReference;
import de.conciso.circulargraph.model.GraphNode;
import de.conciso.circulargraph.model.GraphStatistics;
import de.conciso.circulargraph.model.GraphStatistics.RankedCircular;
import de.conciso.circulargraph.model.Identifier;
import de.conciso.circulargraph.model.ReferenceEdge;
import de.conciso.circulargraph.model.ReferenceGraph;
import de.conciso.circulargraph.model.SkippedDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class JsonGraphWriter {

    private final ObjectMapper objectMapper;

    public JsonGraphWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(ReportData data, Path path) throws IOException {
        objectMapper.writeValue(path.toFile(), toMap(data));
    }

    Map<String, Object> toMap(ReportData data) {
        ReferenceGraph graph = data.graph();

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("timestamp", data.timestamp().toString());

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("runLabel", data.runLabel());
        config.put("indexPath", data.indexPath());
        config.put("corpusPath", data.corpusPath());
        config.put("indexSize", data.indexSize());
        json.put("configuration", config);

        json.put("statistics", statisticsToMap(graph.statistics()));
        json.put("nodes", graph.nodes().stream().map(n -> nodeToMap(n, graph)).toList());
        json.put("edges", graph.edges().stream().map(e -> edgeToMap(e, graph)).toList());

        Map<String, Object> externals = new LinkedHashMap<>();
        graph.externals().forEach((source, refs) ->
                externals.put(source.value(), refs.stream().map(ref -> externalToMap(ref, graph)).toList()));
        json.put("unresolvedReferences", externals);

        json.put("skippedDocuments", graph.skippedDocuments().stream().map(this::skippedToMap).toList());
        return json;
    }

    private Map<String, Object> statisticsToMap(GraphStatistics s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("totalNodes", s.totalNodes());
        m.put("totalEdges", s.totalEdges());
        m.put("internalEdges", s.internalEdges());
        m.put("externalToCorpusEdges", s.externalToCorpusEdges());
        m.put("unscannedNodes", s.unscannedNodes());
        m.put("unresolvedReferences", s.unresolvedReferences());
        m.put("fuzzyMatchedReferences", s.fuzzyMatchedReferences());
        m.put("malformedCandidates", s.malformedCandidates());
        m.put("documentsTotal", s.documentsTotal());
        m.put("documentsScanned", s.documentsScanned());
        m.put("documentsSkipped", s.documentsSkipped());
        m.put("avgReferencesPerDocument", s.avgReferencesPerDocument());

        Map<String, Object> network = new LinkedHashMap<>();
        network.put("density", s.density());
        network.put("averageDegree", s.averageDegree());
        network.put("maxDegree", s.maxDegree());
        network.put("minDegree", s.minDegree());
        network.put("acyclic", s.acyclic());
        network.put("weaklyConnectedComponents", s.weaklyConnectedComponents());
        network.put("stronglyConnectedComponents", s.stronglyConnectedComponents());
        m.put("network", network);
        m.put("mostReferenced", ranked(s.mostReferenced()));
        m.put("mostOutgoing", ranked(s.mostOutgoing()));
        return m;
    }

    private List<Map<String, Object>> ranked(List<RankedCircular> list) {
        return list.stream().map(r -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("circularNo", r.identifier().value());
            m.put("count", r.count());
            return m;
        }).toList();
    }

    private Map<String, Object> nodeToMap(GraphNode node, ReferenceGraph graph) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", node.identifier().value());
        m.put("title", node.title());
        m.put("scanned", node.scanned());
        m.put("outDegree", graph.outDegree(node.identifier()));
        m.put("inDegree", graph.inDegree(node.identifier()));
        return m;
    }

    private Map<String, Object> edgeToMap(ReferenceEdge edge, ReferenceGraph graph) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("source", edge.from().value());
        m.put("target", edge.to().value());
        m.put("count", edge.count());
        m.put("rawText", edge.rawText());
        m.put("patternKind", edge.patternKind().name());
        m.put("internal", graph.isInternal(edge));
        return m;
    }

    private Map<String, Object> externalToMap(ExternalReference ref, ReferenceGraph graph) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("target", ref.target().value());
        m.put("rawText", ref.rawText());
        m.put("patternKind", ref.patternKind().name());
        m.put("count", ref.count());
        m.put("fuzzyMatches", graph.fuzzyMatchesOf(ref).stream().map(Identifier::value).toList());
        return m;
    }

    private Map<String, Object> skippedToMap(SkippedDocument doc) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("document", doc.document());
        m.put("reason", doc.reason().name());
        m.put("detail", doc.detail());
        return m;
    }
}
