package de.conciso.circulargraph.exception;

public class CircularGraphException extends RuntimeException {

    public CircularGraphException(String message) {
        super(message);
    }

    public CircularGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
