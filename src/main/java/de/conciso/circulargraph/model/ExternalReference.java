package de.conciso.circulargraph.model;

/**
 * Candidate whose normalized identifier is not in the Known Index.
 * Deduplicated per (from, target); {@code count} keeps the number of hits.
 */
public record ExternalReference(
        Identifier from,
        Identifier target,
        String rawText,
        PatternKind patternKind,
        int count
) {}
