package de.conciso.circulargraph.model;

import java.util.Objects;

/**
 * Circular-Nummer in kanonischer Form, z.B. {@code SEBI/HO/MRD/MRD-POD-3/P/CIR/2021/672}.
 * Wertobjekt; der Konstruktor prüft nur auf leer. Rohtext bringt der
 * {@code IdentifierNormalizer} in diese Form.
 */
public record Identifier(String value) implements Comparable<Identifier> {

    public Identifier {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
    }

    @Override
    public int compareTo(Identifier other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
