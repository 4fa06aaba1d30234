package de.conciso.circulargraph;

import de.conciso.circulargraph.model.CorpusDocument;
import de.conciso.circulargraph.model.DocumentRecord;
import de.conciso.circulargraph.model.Identifier;
import de.conciso.circulargraph.model.KnownIndex;
import de.conciso.circulargraph.model.ReferenceGraph;
import de.conciso.circulargraph.service.FuzzyMatcher;
import de.conciso.circulargraph.service.IdentifierNormalizer;
import de.conciso.circulargraph.service.IdentifierRecognizer;
import de.conciso.circulargraph.service.KnowledgeGraphBuilder;
import de.conciso.circulargraph.service.ReferenceExtractor;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

/**
 * Gemeinsame Testdaten: drei Circulars A, B, C wie im Beispiel
 * "A zitiert B und C, B zitiert C, C ohne Text".
 */
public final class Fixtures {

    public static final String A_RAW = "SEBI/HO/MRD/MRD-PoD-3/P/CIR/2021/672";
    public static final String B_RAW = "SEBI/HO/CFD/PoD-2/P/CIR/2023/120";
    public static final String C_RAW = "SEBI/HO/MIRSD/MIRSD-PoD-1/P/CIR/2023/70";
    public static final String UNKNOWN_RAW = "SEBI/HO/DDHS/P/CIR/2022/99";

    public static final Identifier A = new Identifier("SEBI/HO/MRD/MRD-POD-3/P/CIR/2021/672");
    public static final Identifier B = new Identifier("SEBI/HO/CFD/POD-2/P/CIR/2023/120");
    public static final Identifier C = new Identifier("SEBI/HO/MIRSD/MIRSD-POD-1/P/CIR/2023/70");
    public static final Identifier UNKNOWN = new Identifier("SEBI/HO/DDHS/P/CIR/2022/99");

    private Fixtures() {
    }

    public static KnownIndex indexOf(Identifier... identifiers) {
        KnownIndex.Builder builder = KnownIndex.builder();
        for (Identifier id : identifiers) {
            builder.put(new DocumentRecord(id, "Title of " + id.value(), null));
        }
        return builder.build();
    }

    public static KnownIndex abcIndex() {
        return indexOf(A, B, C);
    }

    public static List<CorpusDocument> abcCorpus() {
        return List.of(
                new CorpusDocument(A_RAW, "A", "a.txt",
                        "Circular No. " + A_RAW + "\nThis circular refers to " + B_RAW + " and to " + C_RAW + "."),
                new CorpusDocument(B_RAW, "B", "b.txt",
                        "Reference is drawn to " + C_RAW + "."),
                new CorpusDocument(C_RAW, "C", "c.txt", null));
    }

    public static ReferenceExtractor extractor() {
        return new ReferenceExtractor(new IdentifierRecognizer(), new IdentifierNormalizer());
    }

    public static KnowledgeGraphBuilder builder(int parallelism) {
        return new KnowledgeGraphBuilder(extractor(), new IdentifierNormalizer(), new FuzzyMatcher(), parallelism, 10);
    }

    public static ReferenceGraph abcGraph() {
        return builder(1).build(abcCorpus(), abcIndex());
    }

    public static Path resource(String name) {
        try {
            return Path.of(Fixtures.class.getResource("/fixtures/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
