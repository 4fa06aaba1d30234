package de.conciso.circulargraph.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.conciso.circulargraph.model.DependencyNode;
import de.conciso.circulargraph.model.DependencyTrace;
import de.conciso.circulargraph.model.ReferenceGraph;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class TraceJsonWriter {

    private final ObjectMapper objectMapper;

    public TraceJsonWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(ReportData data, Path path) throws IOException {
        objectMapper.writeValue(path.toFile(), toMap(data));
    }

    Map<String, Object> toMap(ReportData data) {
        DependencyTrace trace = data.trace();
        ReferenceGraph graph = data.graph();

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("timestamp", data.timestamp().toString());
        json.put("start", trace.start().value());
        json.put("maxDepth", trace.maxDepth());
        json.put("deepestLevel", trace.deepestLevel());
        json.put("distinctDependencies", trace.distinctDependencies().size());

        Map<String, Object> levels = new LinkedHashMap<>();
        trace.identifiersByLevel().forEach((depth, ids) ->
                levels.put(String.valueOf(depth), ids.stream().map(id -> id.value()).toList()));
        json.put("levels", levels);

        List<Map<String, Object>> nodes = trace.nodes().stream().map(n -> nodeToMap(n, graph)).toList();
        json.put("nodes", nodes);

        json.put("unresolvedReferences", graph.externalsOf(trace.start()).stream()
                .map(e -> e.target().value()).toList());

        Map<String, Object> fuzzy = new LinkedHashMap<>();
        graph.externalsOf(trace.start()).forEach(e -> {
            List<String> matches = graph.fuzzyMatchesOf(e).stream().map(id -> id.value()).toList();
            if (!matches.isEmpty()) fuzzy.put(e.target().value(), matches);
        });
        json.put("fuzzyMatches", fuzzy);
        return json;
    }

    private Map<String, Object> nodeToMap(DependencyNode node, ReferenceGraph graph) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", node.identifier().value());
        m.put("depth", node.depth());
        m.put("discoveredVia", node.discoveredVia() == null ? null : node.discoveredVia().value());
        m.put("revisit", node.revisit());
        m.put("scanned", graph.node(node.identifier()).map(n -> n.scanned()).orElse(false));
        m.put("title", graph.node(node.identifier()).map(n -> n.title()).orElse(null));
        return m;
    }
}
