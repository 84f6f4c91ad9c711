/*
 * To change this template, choose Tools | Templates
 * and open the template in the editor.
 */
package org.aksw.fol2nl.aggregation.rules;

import java.util.List;

import org.aksw.fol2nl.syntax.Category;
import org.aksw.fol2nl.syntax.SyntaxFactory;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodes;

/**
 * Merges two clauses with the same subject and verb that differ in one
 * complement by coordinating that complement: "Mike likes apples. Mike likes
 * bananas." becomes "Mike likes apples and bananas."
 */
public class ObjectMergeRule implements Rule {

    @Override
    public boolean isApplicable(SyntaxNode first, SyntaxNode second) {
        if (!Clauses.isMergeable(first) || !Clauses.isMergeable(second) || !Clauses.sameSubject(first, second)) {
            return false;
        }
        return differingComplement(first.getPredicate(), second.getPredicate()) >= 0;
    }

    @Override
    public SyntaxNode apply(SyntaxNode first, SyntaxNode second) {
        SyntaxNode verbPhrase = first.getPredicate();
        int index = differingComplement(verbPhrase, second.getPredicate());
        List<SyntaxNode> complements = verbPhrase.getChildren();
        complements.set(index,
                SyntaxFactory.coordinated(Clauses.AND, complements.get(index), second.getPredicate().getChild(index)));
        return first;
    }

    /**
     * @return the index of the only complement in which the verb phrases
     *         differ, or -1
     */
    private int differingComplement(SyntaxNode vp1, SyntaxNode vp2) {
        if (!vp1.is(Category.VERB_PHRASE) || !vp2.is(Category.VERB_PHRASE)) {
            return -1;
        }
        if (!vp1.getHead().equals(vp2.getHead()) || vp1.getChildren().size() != vp2.getChildren().size()
                || !vp1.getFeatures().equals(vp2.getFeatures())) {
            return -1;
        }
        int index = -1;
        for (int i = 0; i < vp1.getChildren().size(); i++) {
            if (!SyntaxNodes.sameRealisation(vp1.getChild(i), vp2.getChild(i))) {
                if (index >= 0) {
                    return -1;
                }
                index = i;
            }
        }
        return index;
    }
}
