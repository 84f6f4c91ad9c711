package org.aksw.fol2nl;

/**
 * Thrown when a template or a lexicon entry needed to lexicalise a message is
 * missing. Recoverable: the lexicaliser falls back to a literal placeholder and
 * reports the gap as a warning.
 */
public class LexicalGapException extends Exception {

    private static final long serialVersionUID = 4120557962338420176L;

    private final String key;

    public LexicalGapException(String key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * @return the template name or lexicon key that could not be resolved
     */
    public String getKey() {
        return key;
    }
}
