/**
 *
 */
package org.aksw.fol2nl.semantics;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A conjunction <code>f1 &amp; f2 &amp; ... &amp; fN</code> of at least two
 * formulas.
 */
public final class Conjunction implements Formula {

	private final ImmutableList<Formula> conjuncts;

	public Conjunction(List<? extends Formula> conjuncts) {
		Preconditions.checkArgument(conjuncts.size() >= 2, "a conjunction needs at least two conjuncts");
		this.conjuncts = ImmutableList.copyOf(conjuncts);
	}

	public Conjunction(Formula... conjuncts) {
		this(ImmutableList.copyOf(conjuncts));
	}

	public List<Formula> getConjuncts() {
		return conjuncts;
	}

	@Override
	public <R> R accept(FormulaVisitor<R> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Conjunction && ((Conjunction) obj).conjuncts.equals(conjuncts);
	}

	@Override
	public int hashCode() {
		return conjuncts.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Formula f : conjuncts) {
			if (sb.length() > 0) {
				sb.append(" & ");
			}
			// quantifier scope extends to the right, so it has to be bracketed
			if (f instanceof Quantified) {
				sb.append("(").append(f).append(")");
			} else {
				sb.append(f);
			}
		}
		return sb.toString();
	}
}
