package org.aksw.fol2nl.syntax;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;

/**
 * Static helpers over syntax trees.
 */
public final class SyntaxNodes {

    private static final SurfaceFormVisitor SURFACE_FORM = new SurfaceFormVisitor();

    private SyntaxNodes() {
    }

    /**
     * A rough, uninflected rendering of the subtree: determiners, head words,
     * pronouns and literals in tree order. Two nodes with the same surface form
     * read the same once realised.
     */
    public static String surfaceForm(SyntaxNode node) {
        return node.accept(SURFACE_FORM);
    }

    /**
     * @return the nodes of the subtree in depth-first, left-to-right order
     */
    public static List<SyntaxNode> preorder(SyntaxNode root) {
        List<SyntaxNode> nodes = new ArrayList<SyntaxNode>();
        collect(root, nodes);
        return nodes;
    }

    private static void collect(SyntaxNode node, List<SyntaxNode> nodes) {
        nodes.add(node);
        for (SyntaxNode child : node.getChildren()) {
            collect(child, nodes);
        }
    }

    /**
     * @return the noun phrases of the subtree that mention an entity, in
     *         discourse order
     */
    public static List<SyntaxNode> mentions(SyntaxNode root) {
        List<SyntaxNode> mentions = new ArrayList<SyntaxNode>();
        for (SyntaxNode node : preorder(root)) {
            if (node.is(Category.NOUN_PHRASE) && node.hasReferent()) {
                mentions.add(node);
            }
        }
        return mentions;
    }

    /**
     * Checks whether two subtrees would be realised identically: same shape,
     * same surface form, same tense and polarity, and noun phrases that mention
     * the very same entities.
     */
    public static boolean sameRealisation(SyntaxNode a, SyntaxNode b) {
        if (a.getCategory() != b.getCategory() || a.getChildren().size() != b.getChildren().size()) {
            return false;
        }
        if (a.getReferent() != b.getReferent()) {
            return false;
        }
        if (!Objects.equal(a.getFeature(Feature.TENSE), b.getFeature(Feature.TENSE))
                || a.isFeature(Feature.NEGATED) != b.isFeature(Feature.NEGATED)) {
            return false;
        }
        if (!surfaceForm(a).equals(surfaceForm(b))) {
            return false;
        }
        for (int i = 0; i < a.getChildren().size(); i++) {
            if (!sameRealisation(a.getChild(i), b.getChild(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true if the subtree contains a literal placeholder
     */
    public static boolean containsLiteral(SyntaxNode root) {
        for (SyntaxNode node : preorder(root)) {
            if (node.isLiteralPlaceholder()) {
                return true;
            }
        }
        return false;
    }

    private static class SurfaceFormVisitor implements SyntaxNodeVisitor<String> {

        @Override
        public String visitDocument(SyntaxNode document) {
            return joinChildren(document);
        }

        @Override
        public String visitParagraph(SyntaxNode paragraph) {
            return joinChildren(paragraph);
        }

        @Override
        public String visitClause(SyntaxNode clause) {
            return joinChildren(clause);
        }

        @Override
        public String visitNounPhrase(SyntaxNode nounPhrase) {
            List<String> parts = new ArrayList<String>();
            if (nounPhrase.hasFeature(Feature.DETERMINER)) {
                parts.add(nounPhrase.getFeature(Feature.DETERMINER, String.class));
            }
            parts.add(nounPhrase.getHead());
            for (SyntaxNode child : nounPhrase.getChildren()) {
                parts.add(child.accept(this));
            }
            return Joiner.on(' ').skipNulls().join(parts);
        }

        @Override
        public String visitVerbPhrase(SyntaxNode verbPhrase) {
            List<String> parts = new ArrayList<String>();
            if (verbPhrase.isFeature(Feature.NEGATED)) {
                parts.add("not");
            }
            parts.add(verbPhrase.getHead());
            for (SyntaxNode child : verbPhrase.getChildren()) {
                parts.add(child.accept(this));
            }
            return Joiner.on(' ').skipNulls().join(parts);
        }

        @Override
        public String visitAdjectivePhrase(SyntaxNode adjectivePhrase) {
            return adjectivePhrase.getHead();
        }

        @Override
        public String visitCoordinatedPhrase(SyntaxNode coordinatedPhrase) {
            List<SyntaxNode> coordinates = coordinatedPhrase.getChildren();
            String conjunction = coordinatedPhrase.getFeature(Feature.CONJUNCTION, String.class);
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < coordinates.size(); i++) {
                if (i > 0) {
                    sb.append(i == coordinates.size() - 1 ? " " + conjunction + " " : ", ");
                }
                sb.append(coordinates.get(i).accept(this));
            }
            return sb.toString();
        }

        @Override
        public String visitPlaceholder(SyntaxNode placeholder) {
            return placeholder.isLiteralPlaceholder() ? placeholder.getHead() : "#" + placeholder.getPlaceholderIndex();
        }

        private String joinChildren(SyntaxNode node) {
            List<String> parts = new ArrayList<String>();
            for (SyntaxNode child : node.getChildren()) {
                parts.add(child.accept(this));
            }
            return Joiner.on(' ').join(parts);
        }
    }
}
