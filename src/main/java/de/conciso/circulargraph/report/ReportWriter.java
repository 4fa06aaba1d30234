package de.conciso.circulargraph.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Service
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final String outputPath;
    private final String runGroup;

    private final JsonGraphWriter jsonGraphWriter;
    private final GraphMlWriter graphMlWriter;
    private final CytoscapeWriter cytoscapeWriter;
    private final MarkdownReportWriter markdownReportWriter;
    private final HtmlReportWriter htmlReportWriter;
    private final TraceJsonWriter traceJsonWriter;

    public ReportWriter(
            @Value("${circulargraph.output.path}") String outputPath,
            @Value("${circulargraph.run.group:}") String runGroup,
            JsonGraphWriter jsonGraphWriter,
            GraphMlWriter graphMlWriter,
            CytoscapeWriter cytoscapeWriter,
            MarkdownReportWriter markdownReportWriter,
            HtmlReportWriter htmlReportWriter,
            TraceJsonWriter traceJsonWriter
    ) {
        this.outputPath = outputPath;
        this.runGroup = runGroup;
        this.jsonGraphWriter = jsonGraphWriter;
        this.graphMlWriter = graphMlWriter;
        this.cytoscapeWriter = cytoscapeWriter;
        this.markdownReportWriter = markdownReportWriter;
        this.htmlReportWriter = htmlReportWriter;
        this.traceJsonWriter = traceJsonWriter;
    }

    /**
     * Schreibt Graph-Exporte und Berichte nach {@code <output>/[<group>/]<label>/}.
     *
     * @return Verzeichnis der Ausgabe, oder {@code null} wenn das Schreiben fehlschlug
     */
    public Path writeGraph(ReportData data) {
        String baseName = baseName(data, "circulargraph_");
        try {
            Path dir = outputDirectory(baseName);

            Path jsonPath = dir.resolve(baseName + ".json");
            jsonGraphWriter.write(data, jsonPath);
            log.info("JSON graph written: {}", jsonPath);

            Path graphMlPath = dir.resolve(baseName + ".graphml");
            graphMlWriter.write(data, graphMlPath);
            log.info("GraphML written: {}", graphMlPath);

            Path cytoscapePath = dir.resolve(baseName + "_cytoscape.json");
            cytoscapeWriter.write(data, cytoscapePath);
            log.info("Cytoscape export written: {}", cytoscapePath);

            Path mdPath = dir.resolve(baseName + ".md");
            markdownReportWriter.write(data, mdPath);
            log.info("Markdown report written: {}", mdPath);

            Path htmlPath = dir.resolve(baseName + ".html");
            htmlReportWriter.write(data, htmlPath);
            log.info("HTML report written: {}", htmlPath);

            return dir;
        } catch (IOException e) {
            log.error("Failed to write graph reports", e);
            return null;
        }
    }

    public Path writeTrace(ReportData data) {
        if (data.trace() == null) {
            throw new IllegalArgumentException("report data carries no dependency trace");
        }
        String baseName = baseName(data, "circulargraph_");
        String traceName = "trace_" + baseName;
        try {
            Path dir = outputDirectory(baseName);

            Path jsonPath = dir.resolve(traceName + ".json");
            traceJsonWriter.write(data, jsonPath);
            log.info("JSON trace written: {}", jsonPath);

            Path mdPath = dir.resolve(traceName + ".md");
            markdownReportWriter.writeTrace(data, mdPath);
            log.info("Markdown trace written: {}", mdPath);

            return dir;
        } catch (IOException e) {
            log.error("Failed to write trace reports", e);
            return null;
        }
    }

    private String baseName(ReportData data, String prefix) {
        String runLabel = data.runLabel();
        return (runLabel != null && !runLabel.isBlank())
                ? runLabel
                : prefix + LocalDateTime.now().format(TIMESTAMP_FORMAT);
    }

    private Path outputDirectory(String baseName) throws IOException {
        Path base = Path.of(outputPath);
        if (runGroup != null && !runGroup.isBlank()) {
            base = base.resolve(runGroup);
        }
        Path dir = base.resolve(baseName);
        Files.createDirectories(dir);
        return dir;
    }
}
