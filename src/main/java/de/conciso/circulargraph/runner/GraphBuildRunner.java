package de.conciso.circulargraph.runner;

import de.conciso.circulargraph.model.CorpusDocument;
import de.conciso.circulargraph.model.GraphStatistics;
import de.conciso.circulargraph.model.GraphStatistics.RankedCircular;
import de.conciso.circulargraph.model.KnownIndex;
import de.conciso.circulargraph.model.ReferenceGraph;
import de.conciso.circulargraph.model.SkippedDocument;
import de.conciso.circulargraph.report.ReportData;
import de.conciso.circulargraph.report.ReportWriter;
import de.conciso.circulargraph.service.CorpusLoader;
import de.conciso.circulargraph.service.KnowledgeGraphBuilder;
import de.conciso.circulargraph.service.KnownIndexLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConditionalOnProperty(name = "circulargraph.mode", havingValue = "build", matchIfMissing = true)
public class GraphBuildRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(GraphBuildRunner.class);

    private final KnownIndexLoader indexLoader;
    private final CorpusLoader corpusLoader;
    private final KnowledgeGraphBuilder graphBuilder;
    private final ReportWriter reportWriter;
    private final String indexPath;
    private final String corpusPath;
    private final String runLabel;
    private final String runGroup;

    public GraphBuildRunner(KnownIndexLoader indexLoader, CorpusLoader corpusLoader,
                            KnowledgeGraphBuilder graphBuilder, ReportWriter reportWriter,
                            @Value("${circulargraph.index.path}") String indexPath,
                            @Value("${circulargraph.corpus.path}") String corpusPath,
                            @Value("${circulargraph.run.label:}") String runLabel,
                            @Value("${circulargraph.run.group:}") String runGroup) {
        this.indexLoader = indexLoader;
        this.corpusLoader = corpusLoader;
        this.graphBuilder = graphBuilder;
        this.reportWriter = reportWriter;
        this.indexPath = indexPath;
        this.corpusPath = corpusPath;
        this.runLabel = runLabel;
        this.runGroup = runGroup;
    }

    @Override
    public void run(String... args) throws Exception {
        System.out.println();
        System.out.println("=== Circular Knowledge Graph ===");
        if (runGroup != null && !runGroup.isBlank()) {
            System.out.println("Run-Group : " + runGroup);
        }
        System.out.println("Run-Label : " + (runLabel == null || runLabel.isBlank() ? "(kein Label)" : runLabel));
        System.out.println("Index     : " + indexPath);
        System.out.println("Korpus    : " + corpusPath);
        System.out.println();

        KnownIndex index = indexLoader.load();
        List<CorpusDocument> documents = corpusLoader.load();
        log.info("Loaded {} corpus document(s)", documents.size());

        ReferenceGraph graph = graphBuilder.build(documents, index);

        printSummary(graph);
        reportWriter.writeGraph(ReportData.of(runLabel, indexPath, corpusPath, index.size(), graph));
    }

    private void printSummary(ReferenceGraph graph) {
        GraphStatistics s = graph.statistics();
        String sep = "-".repeat(72);

        System.out.printf("=== Zusammenfassung — %d Dokument(e), %d gescannt, %d übersprungen ===%n",
                s.documentsTotal(), s.documentsScanned(), s.documentsSkipped());
        System.out.println();
        System.out.printf("%-40s %10s%n", "Kennzahl", "Wert");
        System.out.println(sep);
        System.out.printf("%-40s %10d%n", "Knoten", s.totalNodes());
        System.out.printf("%-40s %10d%n", "Kanten", s.totalEdges());
        System.out.printf("%-40s %10d%n", "  intern (Ziel gescannt)", s.internalEdges());
        System.out.printf("%-40s %10d%n", "  extern zum Korpus", s.externalToCorpusEdges());
        System.out.printf("%-40s %10d%n", "Nicht gescannte Knoten", s.unscannedNodes());
        System.out.printf("%-40s %10d%n", "Nicht aufgelöste Referenzen", s.unresolvedReferences());
        System.out.printf("%-40s %10d%n", "  davon unscharf zugeordnet", s.fuzzyMatchedReferences());
        System.out.printf("%-40s %10d%n", "Verworfene Kandidaten", s.malformedCandidates());
        System.out.printf("%-40s %10.2f%n", "Ø Referenzen je Dokument", s.avgReferencesPerDocument());
        System.out.println(sep);
        System.out.printf("%-40s %10.4f%n", "Dichte", s.density());
        System.out.printf("%-40s %10.2f%n", "Ø Grad", s.averageDegree());
        System.out.printf("%-40s %10s%n", "Grad min/max", s.minDegree() + "/" + s.maxDegree());
        System.out.printf("%-40s %10s%n", "Zyklenfrei (DAG)", s.acyclic() ? "ja" : "nein");
        System.out.printf("%-40s %10d%n", "Schwache Zusammenhangskomponenten", s.weaklyConnectedComponents());
        System.out.printf("%-40s %10d%n", "Starke Zusammenhangskomponenten", s.stronglyConnectedComponents());
        System.out.println(sep);

        if (!s.mostReferenced().isEmpty()) {
            System.out.println();
            System.out.println("-- Am häufigsten referenziert --");
            for (RankedCircular r : s.mostReferenced()) {
                System.out.printf("  %-50s %5d%n", r.identifier(), r.count());
            }
        }
        if (!s.mostOutgoing().isEmpty()) {
            System.out.println();
            System.out.println("-- Meiste ausgehende Referenzen --");
            for (RankedCircular r : s.mostOutgoing()) {
                System.out.printf("  %-50s %5d%n", r.identifier(), r.count());
            }
        }
        if (!graph.skippedDocuments().isEmpty()) {
            System.out.println();
            System.out.println("-- Übersprungen --");
            for (SkippedDocument d : graph.skippedDocuments()) {
                System.out.printf("  %-50s %s%n", d.document(), d.reason());
            }
        }
        System.out.println();
    }
}
