package de.conciso.circulargraph.model;

public record DocumentRecord(
        Identifier identifier,
        String title,
        String sourceLocation
) {}
