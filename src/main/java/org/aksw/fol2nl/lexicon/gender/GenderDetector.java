/**
 *
 */
package org.aksw.fol2nl.lexicon.gender;

/**
 * Guesses the gender of a person from a (first) name.
 */
public interface GenderDetector {

    Gender getGender(String name);
}
