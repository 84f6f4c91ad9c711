/**
 *
 */
package org.aksw.fol2nl.semantics;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * An atomic formula <code>Name(arg1, ..., argN)</code>.
 */
public final class Predicate implements Formula {

	private final String name;
	private final ImmutableList<Term> args;

	public Predicate(String name, List<? extends Term> args) {
		Preconditions.checkArgument(name != null && !name.isEmpty(), "predicate name must not be empty");
		this.name = name;
		this.args = ImmutableList.copyOf(args);
	}

	public Predicate(String name, Term... args) {
		this(name, ImmutableList.copyOf(args));
	}

	public String getName() {
		return name;
	}

	public List<Term> getArgs() {
		return args;
	}

	public int getArity() {
		return args.size();
	}

	@Override
	public <R> R accept(FormulaVisitor<R> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Predicate)) {
			return false;
		}
		Predicate other = (Predicate) obj;
		return name.equals(other.name) && args.equals(other.args);
	}

	@Override
	public int hashCode() {
		return 31 * name.hashCode() + args.hashCode();
	}

	@Override
	public String toString() {
		if (args.isEmpty()) {
			return name;
		}
		return name + "(" + Joiner.on(", ").join(args) + ")";
	}
}
