package org.aksw.fol2nl.syntax;

/**
 * Exhaustive dispatch over the {@link Category categories} of syntax nodes:
 * {@link SyntaxNode#accept(SyntaxNodeVisitor)} calls exactly one of these
 * methods.
 *
 * @param <R> the result type
 */
public interface SyntaxNodeVisitor<R> {

    R visitDocument(SyntaxNode document);

    R visitParagraph(SyntaxNode paragraph);

    R visitClause(SyntaxNode clause);

    R visitNounPhrase(SyntaxNode nounPhrase);

    R visitVerbPhrase(SyntaxNode verbPhrase);

    R visitAdjectivePhrase(SyntaxNode adjectivePhrase);

    R visitCoordinatedPhrase(SyntaxNode coordinatedPhrase);

    R visitPlaceholder(SyntaxNode placeholder);
}
