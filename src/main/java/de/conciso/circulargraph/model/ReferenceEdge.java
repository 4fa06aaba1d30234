package de.conciso.circulargraph.model;

import java.util.Objects;

/**
 * One resolved, deduplicated reference. {@code count} is the number of
 * recognizer hits that resolved to the same (from, to) pair; {@code rawText}
 * and {@code patternKind} belong to the representative hit.
 */
public record ReferenceEdge(
        Identifier from,
        Identifier to,
        String rawText,
        PatternKind patternKind,
        int count
) {
    public ReferenceEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.equals(to)) {
            throw new IllegalArgumentException("self-reference is not a valid edge: " + from);
        }
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
    }

    public EdgeKey key() {
        return new EdgeKey(from, to);
    }

    /**
     * Merges another hit set for the same pair. The representative with the
     * higher-priority pattern kind wins.
     */
    public ReferenceEdge merge(ReferenceEdge other) {
        if (!key().equals(other.key())) {
            throw new IllegalArgumentException("cannot merge " + key() + " with " + other.key());
        }
        boolean keepThis = patternKind.ordinal() <= other.patternKind.ordinal();
        return new ReferenceEdge(from, to,
                keepThis ? rawText : other.rawText,
                keepThis ? patternKind : other.patternKind,
                count + other.count);
    }

    public record EdgeKey(Identifier from, Identifier to) {}
}
