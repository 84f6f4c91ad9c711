package org.aksw.fol2nl.lexicon;

public enum PartOfSpeech {
    PROPER_NOUN,
    NOUN,
    VERB,
    ADJECTIVE,
    PRONOUN;
}
