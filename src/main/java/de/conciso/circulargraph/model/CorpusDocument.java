package de.conciso.circulargraph.model;

/**
 * Ein Dokument des Korpus, so wie es vom Loader geliefert wird.
 * {@code identifierRaw} oder {@code text} dürfen fehlen (null); der
 * Graph-Builder überspringt solche Dokumente mit Warnung.
 */
public record CorpusDocument(
        String identifierRaw,
        String title,
        String source,
        String text
) {
    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
