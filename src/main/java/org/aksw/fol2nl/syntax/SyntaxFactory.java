package org.aksw.fol2nl.syntax;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Static builders for {@link SyntaxNode syntax nodes}, used to write template
 * skeletons, e.g.
 *
 * <pre>
 * clause(placeholder(0), verbPhrase("play", placeholder(1)))
 * </pre>
 */
public final class SyntaxFactory {

    private SyntaxFactory() {
    }

    public static SyntaxNode document(List<SyntaxNode> paragraphs) {
        return withChildren(new SyntaxNode(Category.DOCUMENT), paragraphs);
    }

    public static SyntaxNode paragraph(List<SyntaxNode> clauses) {
        return withChildren(new SyntaxNode(Category.PARAGRAPH), clauses);
    }

    public static SyntaxNode clause(SyntaxNode subject, SyntaxNode predicate) {
        SyntaxNode clause = new SyntaxNode(Category.CLAUSE);
        clause.addChild(subject);
        clause.addChild(predicate);
        return clause;
    }

    /**
     * A clause that consists of nothing but canned text.
     */
    public static SyntaxNode cannedClause(String text) {
        return new SyntaxNode(Category.CLAUSE).addChild(literal(text));
    }

    public static SyntaxNode nounPhrase(String head, SyntaxNode... modifiers) {
        return withChildren(new SyntaxNode(Category.NOUN_PHRASE, head), Arrays.asList(modifiers));
    }

    public static SyntaxNode verbPhrase(String verb, SyntaxNode... complements) {
        return withChildren(new SyntaxNode(Category.VERB_PHRASE, verb), Arrays.asList(complements));
    }

    public static SyntaxNode adjectivePhrase(String adjective) {
        return new SyntaxNode(Category.ADJECTIVE_PHRASE, adjective);
    }

    public static SyntaxNode coordinated(String conjunction, SyntaxNode... coordinates) {
        return coordinated(conjunction, Arrays.asList(coordinates));
    }

    public static SyntaxNode coordinated(String conjunction, List<SyntaxNode> coordinates) {
        Preconditions.checkArgument(coordinates.size() >= 2, "a coordination needs at least two coordinates");
        SyntaxNode node = withChildren(new SyntaxNode(Category.COORDINATED_PHRASE), coordinates);
        node.setFeature(Feature.CONJUNCTION, conjunction);
        return node;
    }

    /**
     * A slot for the message argument with the given index.
     */
    public static SyntaxNode placeholder(int index) {
        Preconditions.checkArgument(index >= 0, "placeholder index must not be negative: %s", index);
        SyntaxNode node = new SyntaxNode(Category.PLACEHOLDER);
        node.setPlaceholderIndex(index);
        return node;
    }

    /**
     * A placeholder holding literal text instead of an argument index.
     */
    public static SyntaxNode literal(String text) {
        return new SyntaxNode(Category.PLACEHOLDER, Preconditions.checkNotNull(text));
    }

    private static SyntaxNode withChildren(SyntaxNode node, List<SyntaxNode> children) {
        for (SyntaxNode child : children) {
            node.addChild(child);
        }
        return node;
    }
}
