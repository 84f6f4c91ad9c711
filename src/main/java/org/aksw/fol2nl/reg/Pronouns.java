package org.aksw.fol2nl.reg;

import org.aksw.fol2nl.lexicon.GrammaticalNumber;
import org.aksw.fol2nl.lexicon.gender.Gender;

/**
 * English personal and reflexive pronouns.
 */
final class Pronouns {

    private Pronouns() {
    }

    static boolean hasPronoun(Gender gender) {
        return gender != Gender.UNKNOWN;
    }

    /**
     * @param subject nominative case if true, accusative otherwise
     */
    static String personal(Gender gender, GrammaticalNumber number, boolean subject) {
        if (number == GrammaticalNumber.PLURAL) {
            return subject ? "they" : "them";
        }
        switch (gender) {
        case MALE:
            return subject ? "he" : "him";
        case FEMALE:
            return subject ? "she" : "her";
        case NEUTER:
            return "it";
        default:
            throw new IllegalArgumentException("No pronoun for gender " + gender);
        }
    }

    static String reflexive(Gender gender, GrammaticalNumber number) {
        if (number == GrammaticalNumber.PLURAL) {
            return "themselves";
        }
        switch (gender) {
        case MALE:
            return "himself";
        case FEMALE:
            return "herself";
        case NEUTER:
            return "itself";
        default:
            throw new IllegalArgumentException("No pronoun for gender " + gender);
        }
    }
}
