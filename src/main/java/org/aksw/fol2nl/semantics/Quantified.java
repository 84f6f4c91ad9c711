/**
 *
 */
package org.aksw.fol2nl.semantics;

import com.google.common.base.Preconditions;

/**
 * A quantified formula, e.g. <code>exists x: Dog(x) &amp; Bark(x)</code>.
 */
public final class Quantified implements Formula {

	private final Quantifier quantifier;
	private final Variable variable;
	private final Formula body;

	public Quantified(Quantifier quantifier, Variable variable, Formula body) {
		this.quantifier = Preconditions.checkNotNull(quantifier);
		this.variable = Preconditions.checkNotNull(variable);
		this.body = Preconditions.checkNotNull(body);
	}

	public Quantifier getQuantifier() {
		return quantifier;
	}

	public Variable getVariable() {
		return variable;
	}

	public Formula getBody() {
		return body;
	}

	@Override
	public <R> R accept(FormulaVisitor<R> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Quantified)) {
			return false;
		}
		Quantified other = (Quantified) obj;
		return quantifier == other.quantifier && variable.equals(other.variable) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return (quantifier.hashCode() * 31 + variable.hashCode()) * 31 + body.hashCode();
	}

	@Override
	public String toString() {
		return quantifier.getKeyword() + " " + variable + ": " + body;
	}
}
