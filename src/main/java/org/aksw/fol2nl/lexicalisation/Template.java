package org.aksw.fol2nl.lexicalisation;

import org.aksw.fol2nl.syntax.Category;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodes;

import com.google.common.base.Preconditions;

/**
 * A clause skeleton for one predicate. Placeholders in the skeleton stand for
 * the predicate's arguments by position.
 */
public final class Template {

    private final String name;
    private final SyntaxNode skeleton;
    private final int arity;

    Template(String name, SyntaxNode skeleton) {
        Preconditions.checkArgument(skeleton.is(Category.CLAUSE), "template %s is not a clause: %s", name,
                skeleton);
        this.name = name;
        this.skeleton = skeleton.copy();
        this.arity = validateIndices(name, this.skeleton);
    }

    /**
     * @return the number of arguments the template refers to
     */
    private static int validateIndices(String name, SyntaxNode skeleton) {
        boolean[] used = new boolean[countPlaceholders(skeleton)];
        for (SyntaxNode node : SyntaxNodes.preorder(skeleton)) {
            int index = node.getPlaceholderIndex();
            if (node.is(Category.PLACEHOLDER) && index != SyntaxNode.NO_INDEX) {
                Preconditions.checkArgument(index < used.length,
                        "placeholder indices of template %s are not contiguous from 0", name);
                used[index] = true;
            }
        }
        int arity = 0;
        while (arity < used.length && used[arity]) {
            arity++;
        }
        for (int i = arity; i < used.length; i++) {
            Preconditions.checkArgument(!used[i], "placeholder indices of template %s are not contiguous from 0",
                    name);
        }
        return arity;
    }

    private static int countPlaceholders(SyntaxNode skeleton) {
        int count = 0;
        for (SyntaxNode node : SyntaxNodes.preorder(skeleton)) {
            if (node.is(Category.PLACEHOLDER)) {
                count++;
            }
        }
        return count;
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    /**
     * @return a fresh copy of the skeleton that the caller may modify
     */
    public SyntaxNode instantiate() {
        return skeleton.copy();
    }

    @Override
    public String toString() {
        return name + " -> " + skeleton;
    }
}
