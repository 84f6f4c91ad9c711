package org.aksw.fol2nl.lexicon;

/**
 * Keys of irregular word forms a lexical entry may carry. The realiser uses
 * them instead of its regular morphology.
 */
public enum Inflection {
    PLURAL,
    PAST,
    PAST_PARTICIPLE,
    PRESENT_PARTICIPLE,
    PRESENT3S;
}
