package de.conciso.circulargraph.model;

/**
 * Pattern families of the recognizer, in the order they are applied.
 * The ordinal doubles as priority when an edge picks its representative hit.
 */
public enum PatternKind {
    CIRCULAR_NO_FULL,
    STANDARD_CIR,
    HO_SHORT,
    DATED,
    GAZETTE,
    PARAGRAPH,
    GENERAL_SEBI,
    STANDALONE_CIR,
    LEGACY_CIR
}
