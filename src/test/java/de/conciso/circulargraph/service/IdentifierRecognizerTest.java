package de.conciso.circulargraph.service;

import de.conciso.circulargraph.model.PatternKind;
import de.conciso.circulargraph.model.RawMatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierRecognizerTest {

    private final IdentifierRecognizer recognizer = new IdentifierRecognizer();

    @Test
    void appliesAllNinePatternFamiliesInPriorityOrder() {
        assertThat(recognizer.patternKinds()).containsExactly(PatternKind.values());
    }

    @Test
    void returnsNothingForEmptyText() {
        assertThat(recognizer.recognize(null)).isEmpty();
        assertThat(recognizer.recognize("")).isEmpty();
        assertThat(recognizer.recognize("No references in this paragraph.")).isEmpty();
    }

    @Test
    void strictAndGeneralSebiPatternsBothHitTheSameNumber() {
        List<RawMatch> matches = recognizer.recognize(
                "as specified in SEBI/HO/MRD/MRD-PoD-3/P/CIR/2021/672 the exchanges shall").toList();

        assertThat(matches).extracting(RawMatch::kind)
                .containsExactlyInAnyOrder(PatternKind.STANDARD_CIR, PatternKind.GENERAL_SEBI);
        assertThat(matches).extracting(RawMatch::rawText)
                .containsOnly("SEBI/HO/MRD/MRD-PoD-3/P/CIR/2021/672");
    }

    @Test
    void circularNoPrefixAddsFullPattern() {
        List<RawMatch> matches = recognizer.recognize(
                "SEBI Circular No. SEBI/HO/CFD/PoD-2/P/CIR/2023/120 issued earlier").toList();

        assertThat(matches).extracting(RawMatch::kind)
                .contains(PatternKind.CIRCULAR_NO_FULL, PatternKind.STANDARD_CIR, PatternKind.GENERAL_SEBI);
    }

    @Test
    void toleratesWhitespaceAndLineBreaksAroundSlashes() {
        List<RawMatch> matches = recognizer.recognize(
                "refer SEBI / HO / MRD /\nMRD-PoD-3 / P / CIR / 2021 / 672 for details").toList();

        assertThat(matches).extracting(RawMatch::kind).contains(PatternKind.STANDARD_CIR);
    }

    @Test
    void recognizesShortHoForm() {
        List<RawMatch> matches = recognizer.recognize("vide Circular No. HO/MRD/DP/CIR/P/2016/98 the").toList();

        assertThat(matches).containsExactly(new RawMatch("HO/MRD/DP/CIR/P/2016/98", PatternKind.HO_SHORT));
    }

    @Test
    void shortHoFormDoesNotFireInsideFullNumber() {
        assertThat(recognizer.recognize("SEBI/HO/MRD/MRD-PoD-3/P/CIR/2021/672"))
                .extracting(RawMatch::kind)
                .doesNotContain(PatternKind.HO_SHORT, PatternKind.STANDALONE_CIR);
    }

    @Test
    void recognizesDatedLegacyCircular() {
        List<RawMatch> matches = recognizer.recognize(
                "SEBI Circular No. CIR/MRD/DP/13/2015 dated June 12, 2015").toList();

        assertThat(matches).contains(
                new RawMatch("CIR/MRD/DP/13/2015", PatternKind.DATED),
                new RawMatch("CIR/MRD/DP/13/2015", PatternKind.LEGACY_CIR));
    }

    @Test
    void recognizesGazetteNotification() {
        List<RawMatch> matches = recognizer.recognize(
                "published vide Gazette Notification No. SEBI/LAD-NRO/GN/2018/10 on").toList();

        assertThat(matches).containsExactly(new RawMatch("SEBI/LAD-NRO/GN/2018/10", PatternKind.GAZETTE));
    }

    @Test
    void recognizesParagraphReference() {
        List<RawMatch> matches = recognizer.recognize(
                "in terms of paragraph 4.2 of Master Circular CIR/MRD/DP/13/2015, the").toList();

        assertThat(matches).contains(new RawMatch("CIR/MRD/DP/13/2015", PatternKind.PARAGRAPH));
    }

    @Test
    void standaloneCirIsCaseSensitive() {
        assertThat(recognizer.recognize("see CIR/2009/12 and cir/2009/13"))
                .containsExactly(new RawMatch("CIR/2009/12", PatternKind.STANDALONE_CIR));
    }

    @Test
    void everyCallStartsAFreshStream() {
        String text = "see CIR/2009/12";
        assertThat(recognizer.recognize(text)).hasSize(1);
        assertThat(recognizer.recognize(text)).hasSize(1);
    }
}
