package org.aksw.fol2nl.aggregation.rules;

import org.aksw.fol2nl.syntax.Category;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodes;

/**
 * Shape checks shared by the merge rules.
 */
final class Clauses {

    static final String AND = "and";

    private Clauses() {
    }

    /**
     * @return true for a <code>[subject, verb phrase]</code> clause without
     *         literal text
     */
    static boolean isMergeable(SyntaxNode node) {
        if (!node.is(Category.CLAUSE) || node.getChildren().size() != 2) {
            return false;
        }
        if (SyntaxNodes.containsLiteral(node)) {
            return false;
        }
        SyntaxNode predicate = node.getPredicate();
        return predicate.is(Category.VERB_PHRASE) || predicate.is(Category.COORDINATED_PHRASE);
    }

    /**
     * @return true if the subjects mention two distinct entities, or mention
     *         none at all
     */
    static boolean distinctSubjects(SyntaxNode first, SyntaxNode second) {
        SyntaxNode s1 = first.getSubject();
        SyntaxNode s2 = second.getSubject();
        if (s1.hasReferent() && s1.getReferent() == s2.getReferent()) {
            return false;
        }
        return !sameSubject(first, second);
    }

    /**
     * @return true if both subjects mention the same entities and read the same
     */
    static boolean sameSubject(SyntaxNode first, SyntaxNode second) {
        return SyntaxNodes.sameRealisation(first.getSubject(), second.getSubject());
    }
}
