package org.aksw.fol2nl.semantics;

/**
 * How an entity was introduced: as a named constant or as the variable of a
 * quantifier.
 */
public enum Quantification {
	NONE,
	EXISTENTIAL,
	UNIVERSAL;

	public static Quantification of(Quantifier quantifier) {
		switch (quantifier) {
		case EXISTS:
			return EXISTENTIAL;
		case FORALL:
			return UNIVERSAL;
		default:
			throw new IllegalArgumentException("Unsupported quantifier: " + quantifier);
		}
	}
}
