package de.conciso.circulargraph.exception;

/**
 * Thrown when a trace is requested for a circular that is neither in the
 * Known Index nor in the graph.
 */
public class UnknownCircularException extends CircularGraphException {

    private final String identifier;

    public UnknownCircularException(String identifier) {
        super("Circular not found in index or graph: " + identifier);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
