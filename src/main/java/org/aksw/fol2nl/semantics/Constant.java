/**
 *
 */
package org.aksw.fol2nl.semantics;

import com.google.common.base.Preconditions;

/**
 * A constant term, e.g. <code>john</code> in <code>Play(john, guitar)</code>.
 */
public final class Constant implements Term {

	private final String name;

	public Constant(String name) {
		Preconditions.checkArgument(name != null && !name.isEmpty(), "constant name must not be empty");
		this.name = name;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public boolean isVariable() {
		return false;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Constant && ((Constant) obj).name.equals(name);
	}

	@Override
	public int hashCode() {
		return ("C:" + name).hashCode();
	}

	@Override
	public String toString() {
		return name;
	}
}
