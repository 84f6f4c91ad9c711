/**
 *
 */
package org.aksw.fol2nl.macroplanning;

import java.util.List;

import org.aksw.fol2nl.semantics.Entity;
import org.aksw.fol2nl.semantics.Formula;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A unit of content: one predicate applied to discourse entities, with its
 * polarity and its role in the document plan.
 */
public final class Message implements PlanElement {

	private final String predicate;
	private final ImmutableList<Entity> arguments;
	private final boolean negated;
	private final RhetoricalRelation relation;
	private final int formulaIndex;
	private final Formula source;

	public Message(String predicate, List<Entity> arguments, boolean negated, RhetoricalRelation relation,
			int formulaIndex, Formula source) {
		this.predicate = Preconditions.checkNotNull(predicate);
		this.arguments = ImmutableList.copyOf(arguments);
		this.negated = negated;
		this.relation = Preconditions.checkNotNull(relation);
		this.formulaIndex = formulaIndex;
		this.source = Preconditions.checkNotNull(source);
	}

	public Message withRelation(RhetoricalRelation relation) {
		return new Message(predicate, arguments, negated, relation, formulaIndex, source);
	}

	public String getPredicate() {
		return predicate;
	}

	public List<Entity> getArguments() {
		return arguments;
	}

	public Entity getArgument(int index) {
		return arguments.get(index);
	}

	public int getArity() {
		return arguments.size();
	}

	public boolean isNegated() {
		return negated;
	}

	@Override
	public RhetoricalRelation getRelation() {
		return relation;
	}

	/**
	 * @return the position of the input formula this message was selected from
	 */
	public int getFormulaIndex() {
		return formulaIndex;
	}

	/**
	 * @return the top-level input formula this message was selected from
	 */
	public Formula getSource() {
		return source;
	}

	@Override
	public List<Message> getMessages() {
		return ImmutableList.of(this);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (negated) {
			sb.append('~');
		}
		sb.append(predicate).append('(');
		boolean first = true;
		for (Entity argument : arguments) {
			if (!first) {
				sb.append(", ");
			}
			sb.append(argument.getName());
			first = false;
		}
		return sb.append(')').toString();
	}

	static String toString(List<Message> messages) {
		return Joiner.on("; ").join(messages);
	}
}
