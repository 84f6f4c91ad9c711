/*
 * To change this template, choose Tools | Templates
 * and open the template in the editor.
 */
package org.aksw.fol2nl.aggregation.rules;

import org.aksw.fol2nl.syntax.SyntaxFactory;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodes;

/**
 * Merges two clauses about the same subject by coordinating their predicates:
 * "John plays the guitar. John sings." becomes "John plays the guitar and
 * sings."
 */
public class SubjectMergeRule implements Rule {

    @Override
    public boolean isApplicable(SyntaxNode first, SyntaxNode second) {
        if (!Clauses.isMergeable(first) || !Clauses.isMergeable(second)) {
            return false;
        }
        return Clauses.sameSubject(first, second)
                && !SyntaxNodes.sameRealisation(first.getPredicate(), second.getPredicate());
    }

    @Override
    public SyntaxNode apply(SyntaxNode first, SyntaxNode second) {
        SyntaxNode predicates = SyntaxFactory.coordinated(Clauses.AND, first.getPredicate(), second.getPredicate());
        return SyntaxFactory.clause(first.getSubject(), predicates);
    }
}
