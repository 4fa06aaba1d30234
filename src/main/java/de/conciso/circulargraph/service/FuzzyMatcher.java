package de.conciso.circulargraph.service;

import de.conciso.circulargraph.model.DocumentRecord;
import de.conciso.circulargraph.model.ExternalReference;
import de.conciso.circulargraph.model.Identifier;
import de.conciso.circulargraph.model.KnownIndex;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Sucht für nicht aufgelöste Referenzen passende Einträge im Index.
 * <p>
 * Treffer, wenn eine der beiden kanonischen Nummern die andere enthält,
 * jeweils an {@code /}-Grenzen ausgerichtet ({@code CIR/2023/7} passt nicht
 * auf {@code .../CIR/2023/70}). Das Ergebnis dient nur der Anzeige, es
 * entstehen keine Kanten.
 */
@Component
public class FuzzyMatcher {

    public List<Identifier> fuzzyCandidates(ExternalReference reference, KnownIndex index) {
        String target = bounded(reference.target());
        return index.records().stream()
                .map(DocumentRecord::identifier)
                .filter(id -> !id.equals(reference.from()) && !id.equals(reference.target()))
                .filter(id -> {
                    String candidate = bounded(id);
                    return candidate.contains(target) || target.contains(candidate);
                })
                .sorted()
                .toList();
    }

    private static String bounded(Identifier identifier) {
        return "/" + identifier.value() + "/";
    }
}
