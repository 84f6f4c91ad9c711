/**
 *
 */
package org.aksw.fol2nl.semantics;

/**
 * An argument of a predicate: either a {@link Constant} naming an individual
 * or a {@link Variable} bound by a quantifier.
 */
public interface Term {

	String getName();

	boolean isVariable();
}
