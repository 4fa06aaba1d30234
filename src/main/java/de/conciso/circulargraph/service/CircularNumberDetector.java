package de.conciso.circulargraph.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static de.conciso.circulargraph.service.IdentifierRecognizer.GENERIC_ID;
import static de.conciso.circulargraph.service.IdentifierRecognizer.SEBI_CIR_ID;

/**
 * Ermittelt die eigene Circular-Nummer eines Dokuments aus dem Kopfbereich.
 */
@Component
public class CircularNumberDetector {

    static final int HEADER_LENGTH = 1000;

    private static final List<Pattern> HEADER_PATTERNS = List.of(
            // Nummer in der Zeile nach der Überschrift "CIRCULAR"
            Pattern.compile("^\\s*(?-i:CIRCULAR)\\s*\\n\\s*(" + GENERIC_ID + ")\\b", Pattern.MULTILINE | Pattern.CASE_INSENSITIVE),
            Pattern.compile("Circular\\s+No\\.?\\s*:?\\s*(" + GENERIC_ID + ")\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(" + SEBI_CIR_ID + ")\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*(" + GENERIC_ID + ")\\b", Pattern.MULTILINE | Pattern.CASE_INSENSITIVE)
    );

    public Optional<String> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String header = text.length() > HEADER_LENGTH ? text.substring(0, HEADER_LENGTH) : text;
        for (Pattern pattern : HEADER_PATTERNS) {
            Matcher m = pattern.matcher(header);
            if (m.find()) {
                return Optional.of(m.group(1).replaceAll("\\s+", " ").trim());
            }
        }
        return Optional.empty();
    }
}
