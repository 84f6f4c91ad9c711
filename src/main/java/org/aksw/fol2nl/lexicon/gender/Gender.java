/**
 *
 */
package org.aksw.fol2nl.lexicon.gender;

/**
 * Grammatical gender of a referent. Only referents with a known gender can be
 * pronominalised; {@link #UNKNOWN} has no pronoun forms.
 */
public enum Gender {
    MALE, FEMALE, NEUTER, UNKNOWN;
}
