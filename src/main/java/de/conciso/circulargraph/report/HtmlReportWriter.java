package de.conciso.circulargraph.report;

import de.conciso.circulargraph.model.ExternalReference;
import de.conciso.circulargraph.model.GraphStatistics;
import de.conciso.circulargraph.model.GraphStatistics.RankedCircular;
import de.conciso.circulargraph.model.Identifier;
import de.conciso.circulargraph.model.ReferenceEdge;
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
public class HtmlReportWriter {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    public void write(ReportData data, Path path) throws IOException {
        Files.writeString(path, buildHtml(data), StandardCharsets.UTF_8);
    }

    String buildHtml(ReportData data) {
        String ts = DISPLAY_FORMAT.format(data.timestamp());
        ReferenceGraph graph = data.graph();
        GraphStatistics s = graph.statistics();
        StringBuilder sb = new StringBuilder();

        sb.append("<!DOCTYPE html>\n<html lang=\"de\">\n<head>\n");
        sb.append("<meta charset=\"UTF-8\">\n");
        sb.append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n");
        sb.append("<title>Circular Knowledge Graph — ").append(escape(ts)).append("</title>\n");
        sb.append("<script src=\"https://cdn.jsdelivr.net/npm/chart.js@4\"></script>\n");
        sb.append(css());
        sb.append("</head>\n<body>\n");

        sb.append("<header>\n<h1>Circular Knowledge Graph</h1>\n");
        sb.append("<p class=\"ts\">").append(escape(ts)).append("</p>\n");
        sb.append("<div class=\"cfg\">\n");
        if (data.runLabel() != null && !data.runLabel().isBlank()) {
            sb.append(cfgItem("Run-Label", data.runLabel()));
        }
        sb.append(cfgItem("Index", data.indexPath() + " (" + data.indexSize() + ")"));
        sb.append(cfgItem("Korpus", data.corpusPath()));
        sb.append("</div>\n</header>\n");

        sb.append("<section>\n<h2>Korpus</h2>\n<div class=\"cards\">\n");
        sb.append(card("Dokumente", String.valueOf(s.documentsTotal()), "blue"));
        sb.append(card("Gescannt", String.valueOf(s.documentsScanned()), "green"));
        sb.append(card("Übersprungen", String.valueOf(s.documentsSkipped()), s.documentsSkipped() == 0 ? "green" : "yellow"));
        sb.append(card("Ø Referenzen", String.format("%.2f", s.avgReferencesPerDocument()), "blue"));
        sb.append("</div>\n</section>\n");

        sb.append("<section>\n<h2>Graph</h2>\n<div class=\"cards\">\n");
        sb.append(card("Knoten", String.valueOf(s.totalNodes()), "blue"));
        sb.append(card("Kanten", String.valueOf(s.totalEdges()), "blue"));
        sb.append(card("Intern", String.valueOf(s.internalEdges()), "green"));
        sb.append(card("Extern zum Korpus", String.valueOf(s.externalToCorpusEdges()), "yellow"));
        sb.append(card("Nicht aufgelöst", String.valueOf(s.unresolvedReferences()), s.unresolvedReferences() == 0 ? "green" : "red"));
        sb.append(card("Unscharf zugeordnet", String.valueOf(s.fuzzyMatchedReferences()), "yellow"));
        sb.append("</div>\n</section>\n");

        sb.append("<section>\n<h2>Netzwerk-Kennzahlen</h2>\n<div class=\"cards\">\n");
        sb.append(card("Dichte", String.format("%.4f", s.density()), "blue"));
        sb.append(card("Ø Grad", String.format("%.2f", s.averageDegree()), "blue"));
        sb.append(card("Grad min/max", s.minDegree() + " / " + s.maxDegree(), "blue"));
        sb.append(card("DAG", s.acyclic() ? "ja" : "nein", s.acyclic() ? "green" : "yellow"));
        sb.append(card("Schwache Komponenten", String.valueOf(s.weaklyConnectedComponents()), "blue"));
        sb.append(card("Starke Komponenten", String.valueOf(s.stronglyConnectedComponents()), "blue"));
        sb.append("</div>\n</section>\n");

        if (!s.mostReferenced().isEmpty()) {
            sb.append("<section>\n<h2>Am häufigsten referenziert</h2>\n");
            sb.append("<div class=\"chart-wrap\"><canvas id=\"chart\"></canvas></div>\n");
            appendRankingTable(sb, s.mostReferenced(), "Referenziert von", graph);
            sb.append("</section>\n");
        }
        if (!s.mostOutgoing().isEmpty()) {
            sb.append("<section>\n<h2>Meiste ausgehende Referenzen</h2>\n");
            appendRankingTable(sb, s.mostOutgoing(), "Referenzen", graph);
            sb.append("</section>\n");
        }

        sb.append("<section>\n<h2>Kanten</h2>\n");
        sb.append("<table><thead><tr><th>Von</th><th>Nach</th><th>Treffer</th><th>Pattern</th><th>Fundstelle</th></tr></thead><tbody>\n");
        for (ReferenceEdge e : graph.edges()) {
            sb.append("<tr class=\"").append(graph.isInternal(e) ? "good" : "warn").append("\"><td>")
                    .append(escape(e.from().value())).append("</td><td>")
                    .append(escape(e.to().value())).append("</td><td>")
                    .append(e.count()).append("</td><td>")
                    .append(escape(e.patternKind().name())).append("</td><td class=\"m\">")
                    .append(escape(e.rawText())).append("</td></tr>\n");
        }
        sb.append("</tbody></table>\n</section>\n");

        if (!graph.externals().isEmpty()) {
            sb.append("<section>\n<h2>Nicht aufgelöste Referenzen</h2>\n");
            for (Map.Entry<Identifier, List<ExternalReference>> entry : graph.externals().entrySet()) {
                sb.append("<details>\n<summary><strong>").append(escape(entry.getKey().value()))
                        .append("</strong> — ").append(entry.getValue().size()).append(" Referenz(en)</summary>\n<div class=\"db\">\n");
                sb.append("<table class=\"dt\"><thead><tr><th>Referenz</th><th>Pattern</th><th>Treffer</th><th>Unscharf zugeordnet</th></tr></thead><tbody>\n");
                for (ExternalReference ref : entry.getValue()) {
                    sb.append("<tr><td>").append(escape(ref.target().value())).append("</td><td>")
                            .append(escape(ref.patternKind().name())).append("</td><td>")
                            .append(ref.count()).append("</td><td class=\"m\">")
                            .append(escape(graph.fuzzyMatchesOf(ref).stream().map(Identifier::value)
                                    .collect(Collectors.joining(", ")))).append("</td></tr>\n");
                }
                sb.append("</tbody></table>\n</div>\n</details>\n");
            }
            sb.append("</section>\n");
        }

        if (!graph.skippedDocuments().isEmpty()) {
            sb.append("<section>\n<h2>Übersprungene Dokumente</h2>\n");
            sb.append("<table><thead><tr><th>Dokument</th><th>Grund</th><th>Detail</th></tr></thead><tbody>\n");
            for (SkippedDocument doc : graph.skippedDocuments()) {
                sb.append("<tr class=\"bad\"><td>").append(escape(doc.document())).append("</td><td>")
                        .append(escape(doc.reason().name())).append("</td><td>")
                        .append(doc.detail() == null ? "—" : escape(doc.detail())).append("</td></tr>\n");
            }
            sb.append("</tbody></table>\n</section>\n");
        }

        if (!s.mostReferenced().isEmpty()) {
            sb.append(chartScript(s.mostReferenced()));
        }
        sb.append("</body>\n</html>\n");
        return sb.toString();
    }

    private void appendRankingTable(StringBuilder sb, List<RankedCircular> ranking, String countLabel,
                                    ReferenceGraph graph) {
        sb.append("<table><thead><tr><th>#</th><th>Circular</th><th>Titel</th><th>")
                .append(escape(countLabel)).append("</th></tr></thead><tbody>\n");
        for (int i = 0; i < ranking.size(); i++) {
            RankedCircular r = ranking.get(i);
            String title = graph.node(r.identifier()).map(n -> n.title()).orElse(null);
            sb.append("<tr><td>").append(i + 1).append("</td><td>")
                    .append(escape(r.identifier().value())).append("</td><td>")
                    .append(title == null || title.isBlank() ? "—" : escape(title)).append("</td><td>")
                    .append(r.count()).append("</td></tr>\n");
        }
        sb.append("</tbody></table>\n");
    }

    private String chartScript(List<RankedCircular> ranking) {
        String labels = ranking.stream()
                .map(r -> "\"" + r.identifier().value().replace("\"", "\\\"") + "\"")
                .collect(Collectors.joining(", "));
        String counts = ranking.stream()
                .map(r -> String.valueOf(r.count()))
                .collect(Collectors.joining(", "));

        return "<script>\nnew Chart(document.getElementById('chart').getContext('2d'), {\n"
                + "  type: 'bar',\n"
                + "  data: {\n"
                + "    labels: [" + labels + "],\n"
                + "    datasets: [\n"
                + "      { label: 'Referenziert von', data: [" + counts + "], backgroundColor: 'rgba(54,162,235,0.7)' }\n"
                + "    ]\n  },\n"
                + "  options: { indexAxis: 'y', responsive: true, scales: { x: { beginAtZero: true, ticks: { precision: 0 } } } }\n"
                + "});\n</script>\n";
    }

    private String css() {
        return """
                <style>
                  body { font-family: system-ui, sans-serif; margin: 0; padding: 1rem 2rem; background: #f9f9f9; color: #222; }
                  header { margin-bottom: 1.5rem; }
                  h1 { margin: 0 0 .25rem; }
                  .ts { color: #666; margin: 0 0 1rem; }
                  .cfg { display: flex; gap: 1rem; flex-wrap: wrap; margin-bottom: 1rem; }
                  .ci { background: #fff; border: 1px solid #ddd; border-radius: 6px; padding: .5rem 1rem; }
                  .ci span { display: block; font-size: .75rem; color: #888; }
                  .cards { display: flex; gap: 1rem; flex-wrap: wrap; margin-bottom: 1.5rem; }
                  .card { flex: 1; min-width: 110px; border-radius: 8px; padding: .8rem 1rem; color: #fff; text-align: center; }
                  .card .lbl { font-size: .8rem; opacity: .9; }
                  .card .val { font-size: 1.8rem; font-weight: bold; }
                  .blue { background: #1565c0; } .green { background: #2e7d32; } .yellow { background: #f57f17; } .red { background: #c62828; }
                  table { width: 100%; border-collapse: collapse; background: #fff; border-radius: 8px; overflow: hidden; margin-bottom: 1.5rem; box-shadow: 0 1px 3px rgba(0,0,0,.1); }
                  th, td { padding: .5rem .7rem; text-align: left; border-bottom: 1px solid #eee; }
                  thead { background: #333; color: #fff; }
                  td.m { color: #777; font-size: .85rem; }
                  tr.good { background: #e8f5e9; } tr.warn { background: #fff8e1; } tr.bad { background: #ffebee; }
                  details { background: #fff; border: 1px solid #ddd; border-radius: 6px; margin-bottom: .75rem; }
                  summary { padding: .6rem 1rem; cursor: pointer; }
                  .db { padding: .5rem 1rem 1rem; }
                  table.dt { width: auto; box-shadow: none; margin-bottom: 1rem; }
                  table.dt thead { background: #eee; }
                  table.dt th { color: #333; }
                  .chart-wrap { max-width: 900px; margin-bottom: 2rem; }
                  h2 { margin-top: 1.5rem; }
                  section { margin-bottom: .5rem; }
                </style>
                """;
    }

    private String cfgItem(String label, String value) {
        return "<div class=\"ci\"><span>" + escape(label) + "</span><strong>" + escape(value) + "</strong></div>\n";
    }

    private String card(String label, String value, String cls) {
        return "<div class=\"card " + cls + "\"><div class=\"lbl\">" + escape(label)
                + "</div><div class=\"val\">" + escape(value) + "</div></div>\n";
    }

    private String escape(String t) {
        if (t == null) return "";
        return t.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}
