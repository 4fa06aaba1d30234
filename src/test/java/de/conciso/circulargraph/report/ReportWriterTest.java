package de.conciso.circulargraph.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.conciso.circulargraph.model.DependencyTrace;
import de.conciso.circulargraph.model.ReferenceGraph;
import de.conciso.circulargraph.service.DependencyTracer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static de.conciso.circulargraph.Fixtures.A;
import static de.conciso.circulargraph.Fixtures.abcGraph;
import static de.conciso.circulargraph.Fixtures.abcIndex;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportWriterTest {

    @TempDir
    Path outputDir;

    private final ReferenceGraph graph = abcGraph();

    private ReportWriter writer(String group) {
        TraceTreeRenderer renderer = new TraceTreeRenderer();
        return new ReportWriter(outputDir.toString(), group,
                new JsonGraphWriter(), new GraphMlWriter(), new CytoscapeWriter(),
                new MarkdownReportWriter(renderer), new HtmlReportWriter(), new TraceJsonWriter());
    }

    @Test
    void writesAllGraphFormatsIntoLabelDirectory() throws IOException {
        Path dir = writer("").writeGraph(ReportData.of("run1", "index.txt", "corpus", 3, graph));

        assertThat(dir).isEqualTo(outputDir.resolve("run1"));
        assertThat(dir.resolve("run1.json")).isRegularFile();
        assertThat(dir.resolve("run1.graphml")).isRegularFile();
        assertThat(dir.resolve("run1_cytoscape.json")).isRegularFile();
        assertThat(dir.resolve("run1.md")).isRegularFile();
        assertThat(dir.resolve("run1.html")).isRegularFile();

        JsonNode json = new ObjectMapper().readTree(dir.resolve("run1.json").toFile());
        assertThat(json.path("statistics").path("totalEdges").asInt()).isEqualTo(3);
        assertThat(json.path("configuration").path("indexSize").asInt()).isEqualTo(3);
        assertThat(json.path("skippedDocuments")).hasSize(1);
    }

    @Test
    void groupAddsDirectoryLevel() {
        Path dir = writer("nightly").writeGraph(ReportData.of("run1", "index.txt", "corpus", 3, graph));

        assertThat(dir).isEqualTo(outputDir.resolve("nightly").resolve("run1"));
    }

    @Test
    void missingLabelFallsBackToTimestampName() {
        Path dir = writer("").writeGraph(ReportData.of("", "index.txt", "corpus", 3, graph));

        assertThat(dir.getFileName().toString()).startsWith("circulargraph_");
    }

    @Test
    void writesTraceReports() throws IOException {
        DependencyTrace trace = new DependencyTracer().trace(A, graph, abcIndex());
        Path dir = writer("").writeTrace(ReportData.of("run1", "index.txt", "corpus", 3, graph).withTrace(trace));

        assertThat(dir.resolve("trace_run1.json")).isRegularFile();
        assertThat(Files.readString(dir.resolve("trace_run1.md"))).contains("# Referenzanalyse " + A.value());

        JsonNode json = new ObjectMapper().readTree(dir.resolve("trace_run1.json").toFile());
        assertThat(json.path("start").asText()).isEqualTo(A.value());
        assertThat(json.path("levels").path("2")).hasSize(1);
        assertThat(json.path("nodes")).hasSize(4);
    }

    @Test
    void traceReportRequiresTrace() {
        ReportData data = ReportData.of("run1", "index.txt", "corpus", 3, graph);

        assertThatThrownBy(() -> writer("").writeTrace(data)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unwritableOutputIsLoggedNotThrown() throws IOException {
        Path blocker = Files.writeString(outputDir.resolve("blocker"), "file, not a directory");
        ReportWriter blocked = new ReportWriter(blocker.toString(), "",
                new JsonGraphWriter(), new GraphMlWriter(), new CytoscapeWriter(),
                new MarkdownReportWriter(new TraceTreeRenderer()), new HtmlReportWriter(), new TraceJsonWriter());

        assertThat(blocked.writeGraph(ReportData.of("run1", "index.txt", "corpus", 3, graph))).isNull();
    }
}
