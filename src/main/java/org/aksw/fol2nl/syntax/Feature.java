package org.aksw.fol2nl.syntax;

import java.util.Map;

import org.aksw.fol2nl.lexicon.GrammaticalNumber;
import org.aksw.fol2nl.lexicon.gender.Gender;

/**
 * Keys of the feature mapping of a {@link SyntaxNode}, each with the type its
 * values must have.
 */
public enum Feature {
    TENSE(Tense.class),
    NUMBER(GrammaticalNumber.class),
    GENDER(Gender.class),
    /** determiner word of a noun phrase, absent for bare phrases */
    DETERMINER(String.class),
    PROPER(Boolean.class),
    NEGATED(Boolean.class),
    /** conjunction word of a coordinated phrase */
    CONJUNCTION(String.class),
    REFERRING_FORM(ReferringForm.class),
    /** the head of the noun phrase is a pronoun */
    PRONOUN(Boolean.class),
    REFLEXIVE(Boolean.class),
    /** irregular forms of the head word, keyed by Inflection */
    IRREGULAR_FORMS(Map.class);

    private final Class<?> valueType;

    Feature(Class<?> valueType) {
        this.valueType = valueType;
    }

    public Class<?> getValueType() {
        return valueType;
    }
}
