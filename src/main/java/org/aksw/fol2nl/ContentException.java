package org.aksw.fol2nl;

import org.aksw.fol2nl.semantics.Formula;

/**
 * Thrown when an input formula cannot be turned into messages, e.g. a
 * quantified variable without a class predicate. Fatal: no text is generated
 * for the request.
 */
public class ContentException extends RuntimeException {

    private static final long serialVersionUID = -3390474125467023125L;

    private final Formula formula;

    public ContentException(String message, Formula formula) {
        super(message + ": " + formula);
        this.formula = formula;
    }

    /**
     * @return the top-level input formula that could not be planned
     */
    public Formula getFormula() {
        return formula;
    }
}
