package org.aksw.fol2nl.syntax;

/**
 * How a mention of an entity is realised.
 */
public enum ReferringForm {
    /** first mention: proper name or indefinite/unique noun phrase */
    FULL,
    /** he, she, it, they (and their object and reflexive forms) */
    PRONOUN,
    /** "the X", or the bare name for proper nouns */
    DEFINITE;
}
