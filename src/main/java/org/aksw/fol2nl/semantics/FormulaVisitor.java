/**
 *
 */
package org.aksw.fol2nl.semantics;

/**
 * One method per formula variant.
 *
 * @param <R> the result type
 */
public interface FormulaVisitor<R> {

	R visit(Predicate predicate);

	R visit(Conjunction conjunction);

	R visit(Negation negation);

	R visit(Quantified quantified);
}
