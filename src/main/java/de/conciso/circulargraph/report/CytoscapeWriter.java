package de.conciso.circulargraph.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.conciso.circulargraph.model.ReferenceGraph;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Cytoscape.js {@code elements}-Format. */
@Component
public class CytoscapeWriter {

    private final ObjectMapper objectMapper;

    public CytoscapeWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(ReportData data, Path path) throws IOException {
        objectMapper.writeValue(path.toFile(), toMap(data.graph()));
    }

    Map<String, Object> toMap(ReferenceGraph graph) {
        List<Map<String, Object>> nodes = graph.nodes().stream().map(n -> {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("id", n.identifier().value());
            d.put("label", n.identifier().value());
            d.put("title", n.title() == null ? "" : n.title());
            d.put("scanned", n.scanned());
            d.put("reference_count", graph.outDegree(n.identifier()));
            return Map.<String, Object>of("data", d);
        }).toList();

        List<Map<String, Object>> edges = new ArrayList<>();
        int i = 0;
        for (var edge : graph.edges()) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("id", "e" + i++);
            d.put("source", edge.from().value());
            d.put("target", edge.to().value());
            d.put("label", "references");
            d.put("weight", edge.count());
            edges.add(Map.of("data", d));
        }

        Map<String, Object> elements = new LinkedHashMap<>();
        elements.put("nodes", nodes);
        elements.put("edges", edges);
        return Map.of("elements", elements);
    }
}
