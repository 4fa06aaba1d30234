package de.conciso.circulargraph.runner;

import de.conciso.circulargraph.exception.CircularGraphException;
import de.conciso.circulargraph.model.DependencyNode;
import de.conciso.circulargraph.model.DependencyTrace;
import de.conciso.circulargraph.model.ExternalReference;
import de.conciso.circulargraph.model.Identifier;
import de.conciso.circulargraph.model.KnownIndex;
import de.conciso.circulargraph.model.ReferenceGraph;
import de.conciso.circulargraph.report.ReportData;
import de.conciso.circulargraph.report.ReportWriter;
import de.conciso.circulargraph.report.TraceTreeRenderer;
import de.conciso.circulargraph.service.CorpusLoader;
import de.conciso.circulargraph.service.DependencyTracer;
import de.conciso.circulargraph.service.IdentifierNormalizer;
import de.conciso.circulargraph.service.KnowledgeGraphBuilder;
import de.conciso.circulargraph.service.KnownIndexLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Baut den Graphen und verfolgt die Referenzkette eines einzelnen Circulars.
 * Aktiv mit {@code circulargraph.mode=trace}; das Ziel kommt aus
 * {@code circulargraph.trace.target} oder dem ersten Programmargument.
 */
@Component
@ConditionalOnProperty(name = "circulargraph.mode", havingValue = "trace")
public class TraceRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(TraceRunner.class);

    private final KnownIndexLoader indexLoader;
    private final CorpusLoader corpusLoader;
    private final KnowledgeGraphBuilder graphBuilder;
    private final DependencyTracer tracer;
    private final IdentifierNormalizer normalizer;
    private final TraceTreeRenderer treeRenderer;
    private final ReportWriter reportWriter;
    private final String indexPath;
    private final String corpusPath;
    private final String runLabel;
    private final String target;
    private final int maxDepth;

    public TraceRunner(KnownIndexLoader indexLoader, CorpusLoader corpusLoader,
                       KnowledgeGraphBuilder graphBuilder, DependencyTracer tracer,
                       IdentifierNormalizer normalizer, TraceTreeRenderer treeRenderer,
                       ReportWriter reportWriter,
                       @Value("${circulargraph.index.path}") String indexPath,
                       @Value("${circulargraph.corpus.path}") String corpusPath,
                       @Value("${circulargraph.run.label:}") String runLabel,
                       @Value("${circulargraph.trace.target:}") String target,
                       @Value("${circulargraph.trace.max-depth:5}") int maxDepth) {
        this.indexLoader = indexLoader;
        this.corpusLoader = corpusLoader;
        this.graphBuilder = graphBuilder;
        this.tracer = tracer;
        this.normalizer = normalizer;
        this.treeRenderer = treeRenderer;
        this.reportWriter = reportWriter;
        this.indexPath = indexPath;
        this.corpusPath = corpusPath;
        this.runLabel = runLabel;
        this.target = target;
        this.maxDepth = maxDepth;
    }

    @Override
    public void run(String... args) throws Exception {
        String rawTarget = (target != null && !target.isBlank()) ? target
                : args.length > 0 ? args[0] : null;
        if (rawTarget == null || rawTarget.isBlank()) {
            throw new CircularGraphException("No trace target given (circulargraph.trace.target)");
        }
        Identifier start = normalizer.normalize(rawTarget);
        log.info("Trace target {} (raw '{}'), max depth {}", start, rawTarget, maxDepth);

        KnownIndex index = indexLoader.load();
        ReferenceGraph graph = graphBuilder.build(corpusLoader.load(), index);

        DependencyTrace trace = tracer.trace(start, graph, index, maxDepth);

        printTrace(trace, graph);
        reportWriter.writeTrace(ReportData.of(runLabel, indexPath, corpusPath, index.size(), graph)
                .withTrace(trace));
    }

    private void printTrace(DependencyTrace trace, ReferenceGraph graph) {
        String sep = "-".repeat(72);
        System.out.println();
        System.out.println("=== Referenzanalyse " + trace.start() + " (max. Tiefe " + trace.maxDepth() + ") ===");
        System.out.println();

        for (Map.Entry<Integer, List<DependencyNode>> level : trace.levels().entrySet()) {
            if (level.getKey() == 0) continue;
            String ids = level.getValue().stream()
                    .filter(n -> !n.revisit())
                    .map(n -> n.identifier().value())
                    .collect(Collectors.joining(", "));
            System.out.printf("Ebene %d: %s%n", level.getKey(), ids.isEmpty() ? "(nur bereits erfasste)" : ids);
        }
        System.out.println(sep);
        treeRenderer.render(trace).forEach(System.out::println);
        System.out.println(sep);

        List<ExternalReference> unresolved = graph.externalsOf(trace.start());
        if (!unresolved.isEmpty()) {
            System.out.println("Nicht im Index:");
            for (ExternalReference ref : unresolved) {
                List<Identifier> fuzzy = graph.fuzzyMatchesOf(ref);
                System.out.println("  - " + ref.target() + (fuzzy.isEmpty() ? ""
                        : "  (unscharf: " + fuzzy.stream().map(Identifier::value).collect(Collectors.joining(", ")) + ")"));
            }
        }
        System.out.printf("Direkte Referenzen : %d%n", graph.outDegree(trace.start()));
        System.out.printf("Abhängigkeiten     : %d%n", trace.distinctDependencies().size());
        System.out.printf("Tiefste Ebene      : %d%n", trace.deepestLevel());
        System.out.println();
    }
}
