package org.aksw.fol2nl.macroplanning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import org.aksw.fol2nl.semantics.Entity;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The rhetorical structure of a document. The root relates its clusters by
 * {@link RhetoricalRelation#SEQUENCE}; each cluster is a sub-plan whose
 * children are messages. Immutable, so the presentation order fixed by the
 * macroplanner cannot change downstream.
 */
public final class DocumentPlan implements PlanElement {

	private final RhetoricalRelation relation;
	private final ImmutableList<PlanElement> children;

	public DocumentPlan(RhetoricalRelation relation, List<? extends PlanElement> children) {
		this.relation = Preconditions.checkNotNull(relation);
		this.children = ImmutableList.copyOf(children);
	}

	@Override
	public RhetoricalRelation getRelation() {
		return relation;
	}

	public List<PlanElement> getChildren() {
		return children;
	}

	public boolean isEmpty() {
		return children.isEmpty();
	}

	@Override
	public List<Message> getMessages() {
		List<Message> messages = new ArrayList<Message>();
		for (PlanElement child : children) {
			messages.addAll(child.getMessages());
		}
		return ImmutableList.copyOf(messages);
	}

	/**
	 * @return every entity mentioned by a message of this plan, in order of
	 *         first mention
	 */
	public List<Entity> getEntities() {
		Set<Entity> seen = Collections.newSetFromMap(new IdentityHashMap<Entity, Boolean>());
		List<Entity> entities = new ArrayList<Entity>();
		for (Message message : getMessages()) {
			for (Entity entity : message.getArguments()) {
				if (seen.add(entity)) {
					entities.add(entity);
				}
			}
		}
		return entities;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(relation.name()).append('[');
		boolean first = true;
		for (PlanElement child : children) {
			if (!first) {
				sb.append(", ");
			}
			sb.append(child);
			first = false;
		}
		return sb.append(']').toString();
	}
}
