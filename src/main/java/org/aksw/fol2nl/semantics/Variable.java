/**
 *
 */
package org.aksw.fol2nl.semantics;

import com.google.common.base.Preconditions;

/**
 * A variable term. Variables have to be bound by an enclosing
 * {@link Quantified} formula to be verbalizable.
 */
public final class Variable implements Term {

	private final String name;

	public Variable(String name) {
		Preconditions.checkArgument(name != null && !name.isEmpty(), "variable name must not be empty");
		this.name = name;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public boolean isVariable() {
		return true;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Variable && ((Variable) obj).name.equals(name);
	}

	@Override
	public int hashCode() {
		return ("V:" + name).hashCode();
	}

	@Override
	public String toString() {
		return name;
	}
}
