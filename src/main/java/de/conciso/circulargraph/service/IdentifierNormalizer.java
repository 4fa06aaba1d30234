package de.conciso.circulargraph.service;

import de.conciso.circulargraph.exception.MalformedIdentifierException;
import de.conciso.circulargraph.model.Identifier;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Bringt Circular-Nummern in ihre kanonische Form.
 * <p>
 * Regeln: Klammerzusatz abschneiden, Satzzeichen/Whitespace am Rand entfernen,
 * Whitespace an Trennzeichen entfernen, übrige Whitespace-Folgen zu {@code /}
 * zusammenfassen, Großschreibung. Ziffern bleiben unverändert (kein Padding).
 * Die Funktion ist idempotent.
 */
@Component
public class IdentifierNormalizer {

    private static final Pattern EDGE_NOISE = Pattern.compile("^[^A-Za-z0-9]+|[^A-Za-z0-9]+$");
    private static final Pattern SPACE_AROUND_SEPARATOR = Pattern.compile("\\s*([/_-])\\s*");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern REPEATED_SLASH = Pattern.compile("/{2,}");
    private static final Pattern WELL_FORMED = Pattern.compile("[A-Z0-9]+(?:[/_-][A-Z0-9]+)*");

    public Identifier normalize(String rawText) {
        if (rawText == null) {
            throw new MalformedIdentifierException("null");
        }
        String s = rawText;
        int paren = s.indexOf('(');
        if (paren >= 0) {
            s = s.substring(0, paren);
        }
        s = EDGE_NOISE.matcher(s).replaceAll("");
        s = SPACE_AROUND_SEPARATOR.matcher(s).replaceAll("$1");
        s = WHITESPACE_RUN.matcher(s).replaceAll("/");
        s = REPEATED_SLASH.matcher(s).replaceAll("/");
        s = s.toUpperCase(Locale.ROOT);

        if (!isWellFormed(s)) {
            throw new MalformedIdentifierException(rawText);
        }
        return new Identifier(s);
    }

    /**
     * Like {@link #normalize(String)} but never throws; used where a bad value
     * is simply ignored.
     */
    public Optional<Identifier> tryNormalize(String rawText) {
        try {
            return Optional.of(normalize(rawText));
        } catch (MalformedIdentifierException e) {
            return Optional.empty();
        }
    }

    private boolean isWellFormed(String candidate) {
        return WELL_FORMED.matcher(candidate).matches()
                && candidate.indexOf('/') >= 0
                && candidate.chars().anyMatch(Character::isDigit);
    }
}
