package de.conciso.circulargraph.model;

public record SkippedDocument(String document, Reason reason, String detail) {

    public enum Reason {
        MISSING_TEXT,
        MISSING_IDENTIFIER,
        MALFORMED_IDENTIFIER,
        EXTRACTION_FAILED
    }
}
