/**
 *
 */
package org.aksw.fol2nl.semantics;

import com.google.common.base.Preconditions;

/**
 * A negated formula <code>~f</code>.
 */
public final class Negation implements Formula {

	private final Formula formula;

	public Negation(Formula formula) {
		this.formula = Preconditions.checkNotNull(formula);
	}

	public Formula getFormula() {
		return formula;
	}

	@Override
	public <R> R accept(FormulaVisitor<R> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Negation && ((Negation) obj).formula.equals(formula);
	}

	@Override
	public int hashCode() {
		return 17 + formula.hashCode();
	}

	@Override
	public String toString() {
		if (formula instanceof Predicate || formula instanceof Negation) {
			return "~" + formula;
		}
		return "~(" + formula + ")";
	}
}
