package org.aksw.fol2nl.syntax;

/**
 * The tag of a {@link SyntaxNode}.
 */
public enum Category {
    DOCUMENT,
    PARAGRAPH,
    CLAUSE,
    NOUN_PHRASE,
    VERB_PHRASE,
    ADJECTIVE_PHRASE,
    COORDINATED_PHRASE,
    PLACEHOLDER;
}
