package de.conciso.circulargraph.exception;

public class MalformedIdentifierException extends CircularGraphException {

    private final String rawText;

    public MalformedIdentifierException(String rawText) {
        super("Not a well-formed circular number: '" + rawText + "'");
        this.rawText = rawText;
    }

    public String getRawText() {
        return rawText;
    }
}
