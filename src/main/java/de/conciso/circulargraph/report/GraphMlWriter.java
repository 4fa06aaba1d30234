package de.conciso.circulargraph.report;

import de.conciso.circulargraph.model.GraphNode;
import de.conciso.circulargraph.model.ReferenceEdge;
import de.conciso.circulargraph.model.ReferenceGraph;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * GraphML-Export (gerichtet) für yEd, Gephi &amp; Co.
 */
@Component
public class GraphMlWriter {

    public void write(ReportData data, Path path) throws IOException {
        Files.writeString(path, render(data.graph()), StandardCharsets.UTF_8);
    }

    String render(ReferenceGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<graphml xmlns=\"http://graphml.graphdrawing.org/xmlns\">\n");
        sb.append("  <key id=\"title\" for=\"node\" attr.name=\"title\" attr.type=\"string\"/>\n");
        sb.append("  <key id=\"scanned\" for=\"node\" attr.name=\"scanned\" attr.type=\"boolean\"/>\n");
        sb.append("  <key id=\"out_degree\" for=\"node\" attr.name=\"out_degree\" attr.type=\"int\"/>\n");
        sb.append("  <key id=\"count\" for=\"edge\" attr.name=\"count\" attr.type=\"int\"/>\n");
        sb.append("  <key id=\"pattern_kind\" for=\"edge\" attr.name=\"pattern_kind\" attr.type=\"string\"/>\n");
        sb.append("  <key id=\"internal\" for=\"edge\" attr.name=\"internal\" attr.type=\"boolean\"/>\n");
        sb.append("  <graph id=\"G\" edgedefault=\"directed\">\n");

        for (GraphNode node : graph.nodes()) {
            sb.append("    <node id=\"").append(escape(node.identifier().value())).append("\">\n");
            sb.append("      <data key=\"title\">").append(escape(node.title())).append("</data>\n");
            sb.append("      <data key=\"scanned\">").append(node.scanned()).append("</data>\n");
            sb.append("      <data key=\"out_degree\">").append(graph.outDegree(node.identifier())).append("</data>\n");
            sb.append("    </node>\n");
        }

        int i = 0;
        for (ReferenceEdge edge : graph.edges()) {
            sb.append("    <edge id=\"e").append(i++).append("\" source=\"").append(escape(edge.from().value()))
                    .append("\" target=\"").append(escape(edge.to().value())).append("\">\n");
            sb.append("      <data key=\"count\">").append(edge.count()).append("</data>\n");
            sb.append("      <data key=\"pattern_kind\">").append(edge.patternKind().name()).append("</data>\n");
            sb.append("      <data key=\"internal\">").append(graph.isInternal(edge)).append("</data>\n");
            sb.append("    </edge>\n");
        }

        sb.append("  </graph>\n</graphml>\n");
        return sb.toString();
    }

    private String escape(String t) {
        if (t == null) return "";
        return t.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;")
                .replace("\"", "&quot;").replace("'", "&apos;");
    }
}
