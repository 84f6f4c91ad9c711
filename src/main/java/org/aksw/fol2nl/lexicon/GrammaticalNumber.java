package org.aksw.fol2nl.lexicon;

public enum GrammaticalNumber {
    SINGULAR, PLURAL;
}
