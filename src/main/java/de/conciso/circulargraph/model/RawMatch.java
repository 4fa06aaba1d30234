package de.conciso.circulargraph.model;

public record RawMatch(String rawText, PatternKind kind) {}
