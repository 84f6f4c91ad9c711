package org.aksw.fol2nl;

import java.util.List;

import org.aksw.fol2nl.syntax.SyntaxNode;

import com.google.common.collect.ImmutableList;

/**
 * The finished syntax tree of a request together with the warnings raised
 * while building it.
 */
public final class GenerationResult {

    private final SyntaxNode tree;
    private final ImmutableList<GenerationWarning> warnings;

    public GenerationResult(SyntaxNode tree, List<GenerationWarning> warnings) {
        this.tree = tree;
        this.warnings = ImmutableList.copyOf(warnings);
    }

    /**
     * @return the DOCUMENT node, ready for a realiser
     */
    public SyntaxNode getTree() {
        return tree;
    }

    /**
     * @return lexical gaps and reference ambiguities, in the order they were
     *         found
     */
    public List<GenerationWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return tree + (warnings.isEmpty() ? "" : " " + warnings);
    }
}
