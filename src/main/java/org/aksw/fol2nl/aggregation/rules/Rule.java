/*
 * To change this template, choose Tools | Templates
 * and open the template in the editor.
 */
package org.aksw.fol2nl.aggregation.rules;

import org.aksw.fol2nl.syntax.SyntaxNode;

/**
 * An aggregation rule that merges two adjacent clauses into one.
 */
public interface Rule {

    /**
     * @return true if the two clauses can be merged by this rule
     */
    public boolean isApplicable(SyntaxNode first, SyntaxNode second);

    /**
     * Merges two clauses for which {@link #isApplicable} holds.
     *
     * @return the merged clause
     */
    public SyntaxNode apply(SyntaxNode first, SyntaxNode second);
}
