package org.aksw.fol2nl.realisation;

import org.aksw.fol2nl.RealisationException;
import org.aksw.fol2nl.syntax.SyntaxNode;

/**
 * Turns a finished syntax tree into English text. Morphology (agreement,
 * inflection, "a"/"an", capitalisation and punctuation) is left to the
 * implementation.
 */
public interface Realiser {

    /**
     * @param root a DOCUMENT, PARAGRAPH or CLAUSE node
     * @return the text
     * @throws RealisationException if the tree cannot be realised
     */
    String realise(SyntaxNode root);
}
