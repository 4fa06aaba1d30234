package de.conciso.circulargraph.service;

import de.conciso.circulargraph.exception.CircularGraphException;
import de.conciso.circulargraph.exception.MalformedIdentifierException;
import de.conciso.circulargraph.model.CorpusDocument;
import de.conciso.circulargraph.model.DocumentRecord;
import de.conciso.circulargraph.model.ExternalReference;
import de.conciso.circulargraph.model.ExtractionResult;
import de.conciso.circulargraph.model.GraphNode;
import de.conciso.circulargraph.model.GraphStatistics;
import de.conciso.circulargraph.model.GraphStatistics.RankedCircular;
import de.conciso.circulargraph.model.Identifier;
import de.conciso.circulargraph.model.KnownIndex;
import de.conciso.circulargraph.model.ReferenceEdge;
import de.conciso.circulargraph.model.ReferenceEdge.EdgeKey;
import de.conciso.circulargraph.model.ReferenceGraph;
import de.conciso.circulargraph.model.SkippedDocument;
import de.conciso.circulargraph.model.SkippedDocument.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

@Service
public class KnowledgeGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphBuilder.class);

    private final ReferenceExtractor extractor;
    private final IdentifierNormalizer normalizer;
    private final FuzzyMatcher fuzzyMatcher;
    private final int parallelism;
    private final int topN;

    public KnowledgeGraphBuilder(
            ReferenceExtractor extractor,
            IdentifierNormalizer normalizer,
            FuzzyMatcher fuzzyMatcher,
            @Value("${circulargraph.build.parallelism:1}") int parallelism,
            @Value("${circulargraph.report.top-n:10}") int topN
    ) {
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.fuzzyMatcher = fuzzyMatcher;
        this.parallelism = Math.max(1, parallelism);
        this.topN = topN;
    }

    public ReferenceGraph build(List<CorpusDocument> documents, KnownIndex index) {
        List<SkippedDocument> skipped = new ArrayList<>();
        List<ScanTask> tasks = new ArrayList<>();

        for (CorpusDocument doc : documents) {
            prepare(doc, skipped).ifPresent(tasks::add);
        }
        log.info("Scanning {} of {} document(s) ({} skipped before extraction, parallelism={})",
                tasks.size(), documents.size(), skipped.size(), parallelism);

        List<ExtractionResult> results = parallelism > 1 && tasks.size() > 1
                ? extractParallel(tasks, index, skipped)
                : extractSequential(tasks, index, skipped);

        return assemble(documents.size(), tasks, results, skipped, index);
    }

    // -------------------------------------------------------------------------

    private record ScanTask(Identifier identifier, CorpusDocument document) {}

    private Optional<ScanTask> prepare(CorpusDocument doc, List<SkippedDocument> skipped) {
        String label = doc.source() != null ? doc.source() : doc.identifierRaw();
        if (doc.identifierRaw() == null || doc.identifierRaw().isBlank()) {
            log.warn("Skipping {}: no circular number could be derived", label);
            skipped.add(new SkippedDocument(label, Reason.MISSING_IDENTIFIER, "no circular number"));
            return Optional.empty();
        }
        Identifier identifier;
        try {
            identifier = normalizer.normalize(doc.identifierRaw());
        } catch (MalformedIdentifierException e) {
            log.warn("Skipping {}: {}", label, e.getMessage());
            skipped.add(new SkippedDocument(label, Reason.MALFORMED_IDENTIFIER, doc.identifierRaw()));
            return Optional.empty();
        }
        if (!doc.hasText()) {
            log.warn("Skipping {}: no text available", identifier);
            skipped.add(new SkippedDocument(identifier.value(), Reason.MISSING_TEXT, doc.source()));
            return Optional.empty();
        }
        return Optional.of(new ScanTask(identifier, doc));
    }

    private List<ExtractionResult> extractSequential(List<ScanTask> tasks, KnownIndex index,
                                                     List<SkippedDocument> skipped) {
        List<ExtractionResult> results = new ArrayList<>(tasks.size());
        for (ScanTask task : tasks) {
            results.add(extractSafely(task, index, skipped));
        }
        return results;
    }

    private List<ExtractionResult> extractParallel(List<ScanTask> tasks, KnownIndex index,
                                                   List<SkippedDocument> skipped) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()));
        try {
            List<Future<ExtractionResult>> futures = new ArrayList<>(tasks.size());
            for (ScanTask task : tasks) {
                futures.add(executor.submit(() ->
                        extractor.extract(task.identifier(), task.document().text(), index)));
            }

            // Zusammenführen in Korpus-Reihenfolge, nur in diesem Thread
            List<ExtractionResult> results = new ArrayList<>(tasks.size());
            for (int i = 0; i < futures.size(); i++) {
                ScanTask task = tasks.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    results.add(failed(task, e.getCause(), skipped));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CircularGraphException("Graph build interrupted", e);
                }
            }
            return results;
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private ExtractionResult extractSafely(ScanTask task, KnownIndex index, List<SkippedDocument> skipped) {
        try {
            return extractor.extract(task.identifier(), task.document().text(), index);
        } catch (RuntimeException e) {
            return failed(task, e, skipped);
        }
    }

    private ExtractionResult failed(ScanTask task, Throwable cause, List<SkippedDocument> skipped) {
        log.warn("Extraction failed for {}: {}", task.identifier(), cause.getMessage(), cause);
        skipped.add(new SkippedDocument(task.identifier().value(), Reason.EXTRACTION_FAILED,
                String.valueOf(cause.getMessage())));
        return null;
    }

    // -------------------------------------------------------------------------

    private ReferenceGraph assemble(int documentsTotal, List<ScanTask> tasks, List<ExtractionResult> results,
                                    List<SkippedDocument> skipped, KnownIndex index) {
        Map<Identifier, GraphNode> nodes = new LinkedHashMap<>();
        Map<EdgeKey, ReferenceEdge> edges = new LinkedHashMap<>();
        Map<Identifier, Map<Identifier, ExternalReference>> externals = new LinkedHashMap<>();
        int malformed = 0;

        for (int i = 0; i < tasks.size(); i++) {
            if (results.get(i) == null) continue;
            ScanTask task = tasks.get(i);
            nodes.putIfAbsent(task.identifier(), new GraphNode(task.identifier(),
                    titleOf(task.identifier(), index, task.document().title()), true));
        }

        for (ExtractionResult result : results) {
            if (result == null) continue;
            for (ReferenceEdge edge : result.edges()) {
                edges.merge(edge.key(), edge, ReferenceEdge::merge);
                nodes.putIfAbsent(edge.to(), new GraphNode(edge.to(), titleOf(edge.to(), index, null), false));
            }
            Map<Identifier, ExternalReference> perSource =
                    externals.computeIfAbsent(result.source(), k -> new LinkedHashMap<>());
            for (ExternalReference ext : result.externals()) {
                perSource.merge(ext.target(), ext, (a, b) -> new ExternalReference(a.from(), a.target(),
                        a.rawText(), a.patternKind(), a.count() + b.count()));
            }
            malformed += result.malformedCandidates().size();
        }

        Map<Identifier, List<ExternalReference>> externalLists = new LinkedHashMap<>();
        externals.forEach((source, byTarget) -> {
            if (!byTarget.isEmpty()) externalLists.put(source, new ArrayList<>(byTarget.values()));
        });

        Map<ExternalReference, List<Identifier>> fuzzyMatches = new LinkedHashMap<>();
        externalLists.values().forEach(refs -> refs.forEach(ref -> {
            List<Identifier> candidates = fuzzyMatcher.fuzzyCandidates(ref, index);
            if (!candidates.isEmpty()) {
                log.debug("[{}] {} loosely matches {}", ref.from(), ref.target(), candidates);
                fuzzyMatches.put(ref, candidates);
            }
        }));

        GraphStatistics statistics = statistics(documentsTotal, nodes, edges, externalLists,
                fuzzyMatches.size(), skipped, malformed);
        ReferenceGraph graph = new ReferenceGraph(nodes, edges, externalLists, fuzzyMatches, skipped, statistics);

        log.info("Graph built: {} node(s), {} edge(s) ({} internal, {} external-to-corpus), "
                        + "{} unresolved reference(s), {} of them fuzzy matched",
                statistics.totalNodes(), statistics.totalEdges(), statistics.internalEdges(),
                statistics.externalToCorpusEdges(), statistics.unresolvedReferences(),
                statistics.fuzzyMatchedReferences());
        return graph;
    }

    private String titleOf(Identifier identifier, KnownIndex index, String fallback) {
        return index.resolve(identifier).map(DocumentRecord::title).orElse(fallback);
    }

    private GraphStatistics statistics(int documentsTotal,
                                       Map<Identifier, GraphNode> nodes,
                                       Map<EdgeKey, ReferenceEdge> edges,
                                       Map<Identifier, List<ExternalReference>> externals,
                                       int fuzzyMatched,
                                       List<SkippedDocument> skipped,
                                       int malformed) {
        Map<Identifier, Integer> inDegree = new LinkedHashMap<>();
        Map<Identifier, Integer> outDegree = new LinkedHashMap<>();
        Map<Identifier, List<Identifier>> adjacency = new LinkedHashMap<>();
        int internal = 0;
        for (ReferenceEdge edge : edges.values()) {
            inDegree.merge(edge.to(), 1, Integer::sum);
            outDegree.merge(edge.from(), 1, Integer::sum);
            adjacency.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
            if (nodes.get(edge.to()).scanned()) internal++;
        }

        long scanned = nodes.values().stream().filter(GraphNode::scanned).count();
        int unresolved = externals.values().stream().mapToInt(List::size).sum();
        double avg = scanned == 0 ? 0.0 : Math.round(edges.size() * 100.0 / scanned) / 100.0;
        NetworkMetrics metrics = NetworkMetrics.of(nodes.keySet(), adjacency);

        return new GraphStatistics(
                nodes.size(),
                edges.size(),
                internal,
                edges.size() - internal,
                (int) (nodes.size() - scanned),
                unresolved,
                fuzzyMatched,
                malformed,
                documentsTotal,
                (int) scanned,
                skipped.size(),
                avg,
                metrics.density(),
                metrics.averageDegree(),
                metrics.maxDegree(),
                metrics.minDegree(),
                metrics.acyclic(),
                metrics.weaklyConnectedComponents(),
                metrics.stronglyConnectedComponents(),
                ranking(inDegree),
                ranking(outDegree));
    }

    private List<RankedCircular> ranking(Map<Identifier, Integer> counts) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<Identifier, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(topN)
                .map(e -> new RankedCircular(e.getKey(), e.getValue()))
                .toList();
    }
}
