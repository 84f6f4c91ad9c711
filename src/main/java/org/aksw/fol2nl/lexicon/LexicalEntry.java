package org.aksw.fol2nl.lexicon;

import java.util.EnumMap;
import java.util.Map;

import org.aksw.fol2nl.lexicon.gender.Gender;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * A lexicon entry: the surface word for a key together with its part of
 * speech, agreement features and irregular forms. Immutable.
 */
public final class LexicalEntry {

    private final String key;
    private final String word;
    private final PartOfSpeech partOfSpeech;
    private final Gender gender;
    private final GrammaticalNumber number;
    private final String semanticClass;
    private final ImmutableMap<Inflection, String> irregularForms;

    public LexicalEntry(String key, String word, PartOfSpeech partOfSpeech, Gender gender, GrammaticalNumber number,
            String semanticClass, Map<Inflection, String> irregularForms) {
        this.key = Preconditions.checkNotNull(key);
        this.word = Preconditions.checkNotNull(word);
        this.partOfSpeech = Preconditions.checkNotNull(partOfSpeech);
        this.gender = Preconditions.checkNotNull(gender);
        this.number = Preconditions.checkNotNull(number);
        this.semanticClass = semanticClass != null ? semanticClass : word;
        this.irregularForms = Maps.immutableEnumMap(irregularForms);
    }

    /**
     * A proper noun, e.g. <code>properNoun("john", "John", Gender.MALE)</code>.
     * The semantic class defaults to the name itself.
     */
    public static LexicalEntry properNoun(String key, String name, Gender gender) {
        return new LexicalEntry(key, name, PartOfSpeech.PROPER_NOUN, gender, GrammaticalNumber.SINGULAR, null,
                ImmutableMap.<Inflection, String>of());
    }

    /**
     * A singular common noun without pronoun forms.
     */
    public static LexicalEntry noun(String key, String word) {
        return new LexicalEntry(key, word, PartOfSpeech.NOUN, Gender.UNKNOWN, GrammaticalNumber.SINGULAR, null,
                ImmutableMap.<Inflection, String>of());
    }

    public static LexicalEntry verb(String key, String word) {
        return new LexicalEntry(key, word, PartOfSpeech.VERB, Gender.UNKNOWN, GrammaticalNumber.SINGULAR, null,
                ImmutableMap.<Inflection, String>of());
    }

    public static LexicalEntry adjective(String key, String word) {
        return new LexicalEntry(key, word, PartOfSpeech.ADJECTIVE, Gender.UNKNOWN, GrammaticalNumber.SINGULAR, null,
                ImmutableMap.<Inflection, String>of());
    }

    public LexicalEntry withGender(Gender gender) {
        return new LexicalEntry(key, word, partOfSpeech, gender, number, semanticClass, irregularForms);
    }

    public LexicalEntry withNumber(GrammaticalNumber number) {
        return new LexicalEntry(key, word, partOfSpeech, gender, number, semanticClass, irregularForms);
    }

    public LexicalEntry withSemanticClass(String semanticClass) {
        return new LexicalEntry(key, word, partOfSpeech, gender, number, semanticClass, irregularForms);
    }

    public LexicalEntry withIrregularForm(Inflection inflection, String form) {
        Map<Inflection, String> forms = new EnumMap<Inflection, String>(Inflection.class);
        forms.putAll(irregularForms);
        forms.put(inflection, form);
        return new LexicalEntry(key, word, partOfSpeech, gender, number, semanticClass, forms);
    }

    public String getKey() {
        return key;
    }

    public String getWord() {
        return word;
    }

    public PartOfSpeech getPartOfSpeech() {
        return partOfSpeech;
    }

    public Gender getGender() {
        return gender;
    }

    public GrammaticalNumber getNumber() {
        return number;
    }

    public String getSemanticClass() {
        return semanticClass;
    }

    public Map<Inflection, String> getIrregularForms() {
        return irregularForms;
    }

    public boolean isProperNoun() {
        return partOfSpeech == PartOfSpeech.PROPER_NOUN;
    }

    @Override
    public String toString() {
        return key + " -> " + word + " (" + partOfSpeech + ", " + gender + ", " + number + ")";
    }
}
