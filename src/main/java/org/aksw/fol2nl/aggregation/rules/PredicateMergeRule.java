package org.aksw.fol2nl.aggregation.rules;

import org.aksw.fol2nl.lexicon.GrammaticalNumber;
import org.aksw.fol2nl.syntax.Feature;
import org.aksw.fol2nl.syntax.SyntaxFactory;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodes;

/**
 * Merges two clauses that say the same thing about different subjects by
 * coordinating the subjects: "John plays the guitar. Paul plays the guitar."
 * becomes "John and Paul play the guitar."
 */
public class PredicateMergeRule implements Rule {

    @Override
    public boolean isApplicable(SyntaxNode first, SyntaxNode second) {
        if (!Clauses.isMergeable(first) || !Clauses.isMergeable(second)) {
            return false;
        }
        return Clauses.distinctSubjects(first, second)
                && SyntaxNodes.sameRealisation(first.getPredicate(), second.getPredicate());
    }

    @Override
    public SyntaxNode apply(SyntaxNode first, SyntaxNode second) {
        SyntaxNode subjects = SyntaxFactory.coordinated(Clauses.AND, first.getSubject(), second.getSubject());
        subjects.setFeature(Feature.NUMBER, GrammaticalNumber.PLURAL);
        return SyntaxFactory.clause(subjects, first.getPredicate());
    }
}
