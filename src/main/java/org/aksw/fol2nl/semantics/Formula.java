/**
 *
 */
package org.aksw.fol2nl.semantics;

/**
 * A first-order logic formula. Implementations are immutable and compare
 * structurally.
 *
 * <p>The supported variants are {@link Predicate}, {@link Conjunction},
 * {@link Negation} and {@link Quantified}; code dispatching on formulas does
 * so through {@link FormulaVisitor}.</p>
 */
public interface Formula {

	<R> R accept(FormulaVisitor<R> visitor);
}
