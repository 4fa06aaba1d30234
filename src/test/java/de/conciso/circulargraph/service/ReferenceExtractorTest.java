package de.conciso.circulargraph.service;

import de.conciso.circulargraph.model.ExternalReference;
import de.conciso.circulargraph.model.ExtractionResult;
import de.conciso.circulargraph.model.KnownIndex;
import de.conciso.circulargraph.model.PatternKind;
import de.conciso.circulargraph.model.ReferenceEdge;
import org.junit.jupiter.api.Test;

import static de.conciso.circulargraph.Fixtures.A;
import static de.conciso.circulargraph.Fixtures.A_RAW;
import static de.conciso.circulargraph.Fixtures.B;
import static de.conciso.circulargraph.Fixtures.B_RAW;
import static de.conciso.circulargraph.Fixtures.C;
import static de.conciso.circulargraph.Fixtures.C_RAW;
import static de.conciso.circulargraph.Fixtures.UNKNOWN;
import static de.conciso.circulargraph.Fixtures.UNKNOWN_RAW;
import static de.conciso.circulargraph.Fixtures.abcIndex;
import static de.conciso.circulargraph.Fixtures.extractor;
import static org.assertj.core.api.Assertions.assertThat;

class ReferenceExtractorTest {

    private final ReferenceExtractor extractor = extractor();
    private final KnownIndex index = abcIndex();

    @Test
    void overlappingPatternHitsYieldOneEdge() {
        ExtractionResult result = extractor.extract(A, "as specified in " + B_RAW + ".", index);

        assertThat(result.edges()).hasSize(1);
        ReferenceEdge edge = result.edges().get(0);
        assertThat(edge.from()).isEqualTo(A);
        assertThat(edge.to()).isEqualTo(B);
        assertThat(edge.count()).isEqualTo(2);
        assertThat(edge.patternKind()).isEqualTo(PatternKind.STANDARD_CIR);
        assertThat(edge.rawText()).isEqualTo(B_RAW);
    }

    @Test
    void repeatedMentionsAccumulateCountAndKeepHighestPriorityRepresentative() {
        String text = "Attention is drawn to " + B_RAW + ".\n"
                + "The provisions of Circular No. " + B_RAW + " shall continue to apply.";

        ExtractionResult result = extractor.extract(A, text, index);

        assertThat(result.edges()).singleElement().satisfies(edge -> {
            assertThat(edge.count()).isEqualTo(5);
            assertThat(edge.patternKind()).isEqualTo(PatternKind.CIRCULAR_NO_FULL);
        });
    }

    @Test
    void discardsSelfReference() {
        String text = "Circular No. " + A_RAW + "\nStock exchanges shall bring the provisions of this circular "
                + A_RAW + " to the notice of their members.";

        ExtractionResult result = extractor.extract(A, text, index);

        assertThat(result.edges()).isEmpty();
        assertThat(result.externals()).isEmpty();
        assertThat(result.malformedCandidates()).isEmpty();
    }

    @Test
    void spacedVariantResolvesToIndexedCircular() {
        ExtractionResult result = extractor.extract(A,
                "refer SEBI / HO / MIRSD / MIRSD-PoD-1 / P / CIR / 2023 / 70 for details", index);

        assertThat(result.edges()).extracting(ReferenceEdge::to).containsExactly(C);
    }

    @Test
    void numberWrappedOntoIndentedLineResolvesWithoutTailFragments() {
        ExtractionResult result = extractor.extract(B,
                "Reference is drawn to SEBI/HO/MRD/MRD-POD-3/P/\n        CIR/2021/672 dated", index);

        assertThat(result.edges()).extracting(ReferenceEdge::to).containsExactly(A);
        assertThat(result.externals()).isEmpty();
    }

    @Test
    void wrappedOwnNumberIsDroppedAsSelfReference() {
        ExtractionResult result = extractor.extract(A,
                "Circular No. SEBI /\n        HO/MRD/MRD-POD-3/P/CIR/2021/672", index);

        assertThat(result.edges()).isEmpty();
        assertThat(result.externals()).isEmpty();
    }

    @Test
    void unresolvedCandidatesBecomeOneExternalReferencePerTarget() {
        ExtractionResult result = extractor.extract(A,
                "see " + UNKNOWN_RAW + " and again " + UNKNOWN_RAW + ".", index);

        assertThat(result.edges()).isEmpty();
        assertThat(result.externals()).singleElement().satisfies(ext -> {
            assertThat(ext.from()).isEqualTo(A);
            assertThat(ext.target()).isEqualTo(UNKNOWN);
            assertThat(ext.count()).isEqualTo(4);
        });
    }

    @Test
    void edgesAreSortedByTarget() {
        ExtractionResult result = extractor.extract(A, "see " + C_RAW + " and " + B_RAW, index);

        assertThat(result.edges()).extracting(ReferenceEdge::to).containsExactly(B, C);
    }

    @Test
    void emptyIndexMakesEverythingExternal() {
        ExtractionResult result = extractor.extract(A, "see " + B_RAW, KnownIndex.empty());

        assertThat(result.edges()).isEmpty();
        assertThat(result.externals()).extracting(ExternalReference::target).containsExactly(B);
    }

    @Test
    void textWithoutReferencesYieldsEmptyResult() {
        ExtractionResult result = extractor.extract(A, "SEBI board meeting held today.", index);

        assertThat(result.source()).isEqualTo(A);
        assertThat(result.edges()).isEmpty();
        assertThat(result.externals()).isEmpty();
    }
}
