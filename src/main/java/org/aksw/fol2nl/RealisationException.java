package org.aksw.fol2nl;

/**
 * Thrown by a realiser that cannot turn a syntax tree into text.
 */
public class RealisationException extends RuntimeException {

    private static final long serialVersionUID = 8146259361730915512L;

    public RealisationException(String message) {
        super(message);
    }

    public RealisationException(String message, Throwable cause) {
        super(message, cause);
    }
}
