package de.conciso.circulargraph.report;

import de.conciso.circulargraph.model.DependencyNode;
import de.conciso.circulargraph.model.DependencyTrace;
import de.conciso.circulargraph.model.ExternalReference;
import de.conciso.circulargraph.model.GraphStatistics;
import de.conciso.circulargraph.model.GraphStatistics.RankedCircular;
import de.conciso.circulargraph.model.Identifier;
import de.conciso.circulargraph.model.ReferenceGraph;
import de.conciso.circulargraph.model.SkippedDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class MarkdownReportWriter {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final TraceTreeRenderer treeRenderer;

    public MarkdownReportWriter(TraceTreeRenderer treeRenderer) {
        this.treeRenderer = treeRenderer;
    }

    public void write(ReportData data, Path path) throws IOException {
        Files.writeString(path, renderGraph(data), StandardCharsets.UTF_8);
    }

    public void writeTrace(ReportData data, Path path) throws IOException {
        Files.writeString(path, renderTrace(data), StandardCharsets.UTF_8);
    }

    String renderGraph(ReportData data) {
        StringBuilder sb = new StringBuilder();
        ReferenceGraph graph = data.graph();
        GraphStatistics s = graph.statistics();

        sb.append("# Circular Knowledge Graph — ").append(DISPLAY_FORMAT.format(data.timestamp())).append("\n\n");
        appendConfiguration(sb, data);

        sb.append("## Zusammenfassung\n\n");
        sb.append("| Kennzahl | Wert |\n|---|---|\n");
        sb.append("| Dokumente im Korpus | ").append(s.documentsTotal()).append(" |\n");
        sb.append("| davon gescannt | ").append(s.documentsScanned()).append(" |\n");
        sb.append("| davon übersprungen | ").append(s.documentsSkipped()).append(" |\n");
        sb.append("| Knoten | ").append(s.totalNodes()).append(" |\n");
        sb.append("| Kanten | ").append(s.totalEdges()).append(" |\n");
        sb.append("| Kanten intern (Ziel gescannt) | ").append(s.internalEdges()).append(" |\n");
        sb.append("| Kanten extern zum Korpus (Ziel nur im Index) | ").append(s.externalToCorpusEdges()).append(" |\n");
        sb.append("| Nicht gescannte Knoten | ").append(s.unscannedNodes()).append(" |\n");
        sb.append("| Nicht aufgelöste Referenzen | ").append(s.unresolvedReferences()).append(" |\n");
        sb.append("| davon unscharf zugeordnet | ").append(s.fuzzyMatchedReferences()).append(" |\n");
        sb.append("| Verworfene Kandidaten (malformed) | ").append(s.malformedCandidates()).append(" |\n");
        sb.append(String.format("| Ø Referenzen je Dokument | %.2f |%n", s.avgReferencesPerDocument()));
        sb.append("\n");

        sb.append("## Netzwerk-Kennzahlen\n\n");
        sb.append("| Kennzahl | Wert |\n|---|---|\n");
        sb.append(String.format("| Dichte | %.4f |%n", s.density()));
        sb.append(String.format("| Ø Grad | %.2f |%n", s.averageDegree()));
        sb.append("| Max. Grad | ").append(s.maxDegree()).append(" |\n");
        sb.append("| Min. Grad | ").append(s.minDegree()).append(" |\n");
        sb.append("| Zyklenfrei (DAG) | ").append(s.acyclic() ? "ja" : "nein").append(" |\n");
        sb.append("| Schwache Zusammenhangskomponenten | ").append(s.weaklyConnectedComponents()).append(" |\n");
        sb.append("| Starke Zusammenhangskomponenten | ").append(s.stronglyConnectedComponents()).append(" |\n");
        sb.append("\n");

        appendRanking(sb, "Am häufigsten referenziert", "Referenziert von", s.mostReferenced(), graph);
        appendRanking(sb, "Meiste ausgehende Referenzen", "Referenzen", s.mostOutgoing(), graph);

        if (!graph.externals().isEmpty()) {
            sb.append("## Nicht aufgelöste Referenzen\n\n");
            sb.append("Diese Circulars sind nicht im Index und können nicht weiter verfolgt werden.\n\n");
            sb.append("| Quelle | Referenz | Pattern | Treffer | Unscharf zugeordnet |\n|---|---|---|---|---|\n");
            for (Map.Entry<Identifier, List<ExternalReference>> e : graph.externals().entrySet()) {
                for (ExternalReference ref : e.getValue()) {
                    sb.append("| ").append(e.getKey()).append(" | ").append(ref.target())
                            .append(" | ").append(ref.patternKind()).append(" | ").append(ref.count())
                            .append(" | ").append(joined(graph.fuzzyMatchesOf(ref))).append(" |\n");
                }
            }
            sb.append("\n");
        }

        if (!graph.skippedDocuments().isEmpty()) {
            sb.append("## Übersprungene Dokumente\n\n");
            sb.append("| Dokument | Grund | Detail |\n|---|---|---|\n");
            for (SkippedDocument doc : graph.skippedDocuments()) {
                sb.append("| ").append(doc.document()).append(" | ").append(doc.reason())
                        .append(" | ").append(doc.detail() == null ? "—" : doc.detail()).append(" |\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    String renderTrace(ReportData data) {
        DependencyTrace trace = data.trace();
        ReferenceGraph graph = data.graph();
        StringBuilder sb = new StringBuilder();

        sb.append("# Referenzanalyse ").append(trace.start()).append("\n\n");
        sb.append("Erstellt: ").append(DISPLAY_FORMAT.format(data.timestamp()))
                .append(" · max. Tiefe: ").append(trace.maxDepth()).append("\n\n");

        sb.append("## Ebenen\n\n");
        for (Map.Entry<Integer, List<DependencyNode>> level : trace.levels().entrySet()) {
            sb.append("### Ebene ").append(level.getKey()).append("\n\n");
            for (DependencyNode node : level.getValue()) {
                sb.append("- ").append(node.identifier());
                if (node.discoveredVia() != null) {
                    sb.append(" ← ").append(node.discoveredVia());
                }
                if (node.revisit()) {
                    sb.append(" _(bereits erfasst)_");
                } else if (graph.node(node.identifier()).map(n -> !n.scanned()).orElse(true)) {
                    sb.append(" _(nicht gescannt)_");
                }
                sb.append("\n");
            }
            sb.append("\n");
        }

        sb.append("## Baum\n\n```\n");
        treeRenderer.render(trace).forEach(line -> sb.append(line).append("\n"));
        sb.append("```\n\n");

        List<ExternalReference> unresolved = graph.externalsOf(trace.start());
        if (!unresolved.isEmpty()) {
            sb.append("## Nicht im Index\n\n");
            for (ExternalReference ref : unresolved) {
                sb.append("- ").append(ref.target());
                List<Identifier> fuzzy = graph.fuzzyMatchesOf(ref);
                if (!fuzzy.isEmpty()) {
                    sb.append(" _(unscharf: ").append(joined(fuzzy)).append(")_");
                }
                sb.append("\n");
            }
            sb.append("\n");
        }

        sb.append("## Zusammenfassung\n\n");
        sb.append("| Kennzahl | Wert |\n|---|---|\n");
        sb.append("| Direkte Referenzen | ").append(graph.outDegree(trace.start())).append(" |\n");
        sb.append("| Abhängigkeiten gesamt (distinct) | ").append(trace.distinctDependencies().size()).append(" |\n");
        sb.append("| Tiefste Ebene | ").append(trace.deepestLevel()).append(" |\n");
        return sb.toString();
    }

    private String joined(List<Identifier> identifiers) {
        if (identifiers.isEmpty()) return "—";
        return identifiers.stream().map(Identifier::value).collect(Collectors.joining(", "));
    }

    private void appendConfiguration(StringBuilder sb, ReportData data) {
        sb.append("## Konfiguration\n\n");
        sb.append("| Parameter | Wert |\n|---|---|\n");
        if (data.runLabel() != null && !data.runLabel().isBlank()) {
            sb.append("| Run-Label | ").append(data.runLabel()).append(" |\n");
        }
        sb.append("| Index | ").append(data.indexPath()).append(" (").append(data.indexSize()).append(" Circulars) |\n");
        sb.append("| Korpus | ").append(data.corpusPath()).append(" |\n\n");
    }

    private void appendRanking(StringBuilder sb, String heading, String countLabel,
                               List<RankedCircular> ranking, ReferenceGraph graph) {
        if (ranking.isEmpty()) return;
        sb.append("## ").append(heading).append("\n\n");
        sb.append("| # | Circular | Titel | ").append(countLabel).append(" |\n|---|---|---|---|\n");
        for (int i = 0; i < ranking.size(); i++) {
            RankedCircular r = ranking.get(i);
            String title = graph.node(r.identifier()).map(n -> n.title()).orElse(null);
            sb.append("| ").append(i + 1).append(" | ").append(r.identifier())
                    .append(" | ").append(title == null || title.isBlank() ? "—" : title)
                    .append(" | ").append(r.count()).append(" |\n");
        }
        sb.append("\n");
    }
}
