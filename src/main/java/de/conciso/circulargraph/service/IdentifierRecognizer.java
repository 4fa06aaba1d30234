package de.conciso.circulargraph.service;

import de.conciso.circulargraph.model.PatternKind;
import de.conciso.circulargraph.model.RawMatch;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Findet Kandidaten für Circular-Nummern im Volltext.
 * <p>
 * Alle Pattern laufen unabhängig über den gesamten Text; Treffer werden hier
 * nicht dedupliziert, damit erkennbar bleibt, welches Pattern getroffen hat.
 */
@Component
public class IdentifierRecognizer {

    // '/' darf von Whitespace und Zeilenumbrüchen umgeben sein (PDF-Textextraktion)
    static final String SEP = "\\s*/\\s*";
    static final String SEG = "[A-Z0-9]+(?:-\\s*[A-Z0-9]+)*";
    static final String GENERIC_ID = "[A-Z]{2,}(?:" + SEP + SEG + ")+" + SEP + "\\d+";
    static final String SEBI_CIR_ID = "SEBI" + SEP + "HO" + SEP + "[A-Z]+(?:-[A-Z]+)?"
            + "(?:" + SEP + SEG + ")*" + "(?:" + SEP + "P)?" + SEP + "CIR" + SEP + "\\d{4}" + SEP + "\\d+";

    private static final int CI = Pattern.CASE_INSENSITIVE;
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private static final List<ReferencePattern> PATTERNS = List.of(
            new ReferencePattern(PatternKind.CIRCULAR_NO_FULL, Pattern.compile(
                    "(?:SEBI\\s+)?Circular\\s+No\\.?\\s*:?\\s*(SEBI" + SEP + "HO(?:" + SEP + SEG + ")+" + SEP + "\\d+)\\b", CI)),
            new ReferencePattern(PatternKind.STANDARD_CIR, Pattern.compile(
                    "\\b(SEBI" + SEP + "HO(?:" + SEP + SEG + ")*?(?:" + SEP + "P)?" + SEP + "CIR" + SEP + "\\d{4}" + SEP + "\\d+)\\b", CI)),
            new ReferencePattern(PatternKind.HO_SHORT, Pattern.compile(
                    "(?:Circular\\s+No\\.?\\s*:?\\s*)?(?<!SEBI\\s{0,3}/\\s{0,3})\\b(HO(?:" + SEP + SEG + ")+" + SEP + "\\d+)\\b", CI)),
            new ReferencePattern(PatternKind.DATED, Pattern.compile(
                    "Circular\\s+No\\.?\\s*:?\\s*(" + GENERIC_ID + ")\\s+dated\\b", CI)),
            new ReferencePattern(PatternKind.GAZETTE, Pattern.compile(
                    "Gazette\\s+Notifications?\\s+No\\.?\\s*:?\\s*(" + GENERIC_ID + ")\\b", CI)),
            new ReferencePattern(PatternKind.PARAGRAPH, Pattern.compile(
                    "\\b(?:paragraph|para)\\s+[\\d.]+\\s+of\\s+(?:SEBI\\s+)?(?:Master\\s+)?Circular\\s+(?:No\\.?\\s*:?\\s*)?("
                            + GENERIC_ID + ")\\b", CI)),
            new ReferencePattern(PatternKind.GENERAL_SEBI, Pattern.compile(
                    "\\b(" + SEBI_CIR_ID + ")\\b", CI)),
            new ReferencePattern(PatternKind.STANDALONE_CIR, Pattern.compile(
                    "(?<!/\\s{0,3})\\b(CIR" + SEP + "\\d{4}" + SEP + "\\d+)\\b")),
            new ReferencePattern(PatternKind.LEGACY_CIR, Pattern.compile(
                    "(?<!/\\s{0,3})\\b(CIR" + SEP + "[A-Z]{2,}(?:" + SEP + SEG + ")*" + SEP + "\\d+" + SEP + "\\d{4})\\b"))
    );

    /**
     * Liefert alle Treffer als lazy Stream, Pattern für Pattern in fester
     * Reihenfolge. Jeder Aufruf startet neu.
     * <p>
     * Whitespace-Folgen werden vorher zu einem Leerzeichen zusammengefasst,
     * sonst greifen die Lookbehinds nicht bei umbrochenen Nummern.
     */
    public Stream<RawMatch> recognize(String text) {
        if (text == null || text.isEmpty()) {
            return Stream.empty();
        }
        String flat = WHITESPACE_RUN.matcher(text).replaceAll(" ");
        return PATTERNS.stream().flatMap(p -> p.matches(flat));
    }

    public List<PatternKind> patternKinds() {
        return PATTERNS.stream().map(ReferencePattern::kind).toList();
    }

    private record ReferencePattern(PatternKind kind, Pattern regex) {

        Stream<RawMatch> matches(String text) {
            return regex.matcher(text).results()
                    .map(r -> new RawMatch(r.group(1), kind));
        }
    }
}
