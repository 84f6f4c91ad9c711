package org.aksw.fol2nl.syntax;

public enum Tense {
    PAST, PRESENT, FUTURE;
}
