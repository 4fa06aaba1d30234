package de.conciso.circulargraph.service;

import de.conciso.circulargraph.exception.MalformedIdentifierException;
import de.conciso.circulargraph.model.ExternalReference;
import de.conciso.circulargraph.model.ExtractionResult;
import de.conciso.circulargraph.model.Identifier;
import de.conciso.circulargraph.model.KnownIndex;
import de.conciso.circulargraph.model.RawMatch;
import de.conciso.circulargraph.model.ReferenceEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

@Service
public class ReferenceExtractor {

    private static final Logger log = LoggerFactory.getLogger(ReferenceExtractor.class);

    private final IdentifierRecognizer recognizer;
    private final IdentifierNormalizer normalizer;

    public ReferenceExtractor(IdentifierRecognizer recognizer, IdentifierNormalizer normalizer) {
        this.recognizer = recognizer;
        this.normalizer = normalizer;
    }

    /**
     * Extrahiert die Referenzen eines Dokuments. Selbstreferenzen werden
     * verworfen, aufgelöste Treffer je Ziel zu einer Kante zusammengefasst,
     * nicht aufgelöste je Ziel zu einer ExternalReference.
     */
    public ExtractionResult extract(Identifier source, String text, KnownIndex index) {
        // TreeMap: Kanten und externe Referenzen nach Ziel sortiert
        Map<Identifier, ReferenceEdge> edges = new TreeMap<>();
        Map<Identifier, ExternalReference> externals = new TreeMap<>();
        List<String> malformed = new ArrayList<>();

        try (Stream<RawMatch> matches = recognizer.recognize(text)) {
            Iterator<RawMatch> it = matches.iterator();
            while (it.hasNext()) {
                RawMatch match = it.next();
                String raw = match.rawText().replaceAll("\\s+", " ").trim();

                Identifier target;
                try {
                    target = normalizer.normalize(raw);
                } catch (MalformedIdentifierException e) {
                    log.warn("[{}] Discarding malformed candidate '{}' ({})", source, raw, match.kind());
                    malformed.add(raw);
                    continue;
                }

                if (target.equals(source)) {
                    log.debug("[{}] Skipping self-reference: {}", source, raw);
                    continue;
                }

                if (index.contains(target)) {
                    edges.merge(target, new ReferenceEdge(source, target, raw, match.kind(), 1), ReferenceEdge::merge);
                } else {
                    externals.merge(target, new ExternalReference(source, target, raw, match.kind(), 1),
                            (a, b) -> new ExternalReference(a.from(), a.target(), a.rawText(), a.patternKind(),
                                    a.count() + b.count()));
                }
            }
        }

        log.debug("[{}] {} resolved, {} unresolved, {} malformed",
                source, edges.size(), externals.size(), malformed.size());
        return new ExtractionResult(source, new ArrayList<>(edges.values()),
                new ArrayList<>(externals.values()), malformed);
    }
}
