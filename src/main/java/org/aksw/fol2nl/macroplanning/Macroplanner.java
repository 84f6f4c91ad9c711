/**
 *
 */
package org.aksw.fol2nl.macroplanning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.aksw.fol2nl.ContentException;
import org.aksw.fol2nl.lexicon.Lexicon;
import org.aksw.fol2nl.semantics.Conjunction;
import org.aksw.fol2nl.semantics.Constant;
import org.aksw.fol2nl.semantics.Entity;
import org.aksw.fol2nl.semantics.Formula;
import org.aksw.fol2nl.semantics.FormulaVisitor;
import org.aksw.fol2nl.semantics.Negation;
import org.aksw.fol2nl.semantics.Predicate;
import org.aksw.fol2nl.semantics.Quantified;
import org.aksw.fol2nl.semantics.Term;
import org.aksw.fol2nl.semantics.Variable;
import org.apache.log4j.Logger;

/**
 * Selects the content of a set of formulas and orders it into a
 * {@link DocumentPlan}.
 *
 * <p>Every top-level conjunct becomes a {@link Message}. A quantified variable
 * must be restricted by a unary predicate in its scope, e.g.
 * <code>exists x: Dog(x) &amp; Bark(x)</code>; that predicate names the class
 * of the new entity and is not verbalised as a message of its own.</p>
 *
 * <p>Messages are then clustered: each message joins the earlier cluster that
 * shares most entities with it, so that related statements end up in the same
 * paragraph.</p>
 */
public class Macroplanner {

	private static final Logger logger = Logger.getLogger(Macroplanner.class.getName());

	private final Lexicon lexicon;
	private boolean groupRelatedMessages = true;

	/**
	 * @param lexicon used to fill in gender, number and class of entities; may
	 *            be <code>null</code>, in which case defaults are used
	 */
	public Macroplanner(Lexicon lexicon) {
		this.lexicon = lexicon;
	}

	/**
	 * Whether messages about the same entities are grouped into one cluster
	 * (default). If disabled, every message forms a cluster of its own.
	 */
	public void setGroupRelatedMessages(boolean groupRelatedMessages) {
		this.groupRelatedMessages = groupRelatedMessages;
	}

	public boolean isGroupRelatedMessages() {
		return groupRelatedMessages;
	}

	/**
	 * Builds the document plan for the given formulas.
	 *
	 * @param formulas the input, in presentation order
	 * @return the document plan
	 * @throws ContentException if a formula cannot be expressed as messages
	 */
	public DocumentPlan plan(List<Formula> formulas) {
		EntityRegistry registry = new EntityRegistry(lexicon);
		List<Message> messages = new ArrayList<Message>();
		for (int i = 0; i < formulas.size(); i++) {
			Formula formula = formulas.get(i);
			formula.accept(new ContentSelector(registry, formula, i, messages));
		}
		logger.debug("Selected messages: " + Message.toString(messages));

		List<List<Message>> clusters = groupRelatedMessages ? cluster(messages) : singletons(messages);
		List<DocumentPlan> children = new ArrayList<DocumentPlan>();
		for (List<Message> cluster : clusters) {
			List<Message> elements = new ArrayList<Message>();
			for (int i = 0; i < cluster.size(); i++) {
				RhetoricalRelation role = i == 0 ? RhetoricalRelation.NUCLEUS : RhetoricalRelation.ELABORATION;
				elements.add(cluster.get(i).withRelation(role));
			}
			children.add(new DocumentPlan(RhetoricalRelation.ELABORATION, elements));
		}
		DocumentPlan plan = new DocumentPlan(RhetoricalRelation.SEQUENCE, children);
		logger.info("Planned " + messages.size() + " message(s) in " + clusters.size() + " cluster(s)");
		return plan;
	}

	/**
	 * Greedy clustering in input order. A message joins the cluster with the
	 * highest positive relatedness score, the earliest one on ties, or opens a
	 * new cluster.
	 */
	private List<List<Message>> cluster(List<Message> messages) {
		List<List<Message>> clusters = new ArrayList<List<Message>>();
		for (Message message : messages) {
			List<Message> best = null;
			int bestScore = 0;
			for (List<Message> cluster : clusters) {
				int score = relatedness(message, cluster);
				if (score > bestScore) {
					bestScore = score;
					best = cluster;
				}
			}
			if (best == null) {
				best = new ArrayList<Message>();
				clusters.add(best);
			}
			best.add(message);
		}
		return clusters;
	}

	/**
	 * The number of the message's entities that the cluster mentions. The
	 * message's first argument counts twice if it is also the first argument
	 * of a message in the cluster.
	 */
	static int relatedness(Message message, List<Message> cluster) {
		Set<Entity> clusterEntities = identitySet();
		Set<Entity> clusterSubjects = identitySet();
		for (Message m : cluster) {
			clusterEntities.addAll(m.getArguments());
			if (m.getArity() > 0) {
				clusterSubjects.add(m.getArgument(0));
			}
		}
		int score = 0;
		Set<Entity> counted = identitySet();
		for (Entity entity : message.getArguments()) {
			if (counted.add(entity) && clusterEntities.contains(entity)) {
				score++;
			}
		}
		if (message.getArity() > 0 && clusterSubjects.contains(message.getArgument(0))) {
			score++;
		}
		return score;
	}

	private static List<List<Message>> singletons(List<Message> messages) {
		List<List<Message>> clusters = new ArrayList<List<Message>>();
		for (Message message : messages) {
			clusters.add(Collections.singletonList(message));
		}
		return clusters;
	}

	private static Set<Entity> identitySet() {
		return Collections.newSetFromMap(new IdentityHashMap<Entity, Boolean>());
	}

	/**
	 * Walks one top-level formula and emits its messages.
	 */
	private static class ContentSelector implements FormulaVisitor<Void> {

		private final EntityRegistry registry;
		private final Formula topLevel;
		private final int formulaIndex;
		private final List<Message> messages;
		private final Map<String, Entity> scope = new HashMap<String, Entity>();

		ContentSelector(EntityRegistry registry, Formula topLevel, int formulaIndex, List<Message> messages) {
			this.registry = registry;
			this.topLevel = topLevel;
			this.formulaIndex = formulaIndex;
			this.messages = messages;
		}

		@Override
		public Void visit(Predicate predicate) {
			addMessage(predicate, false);
			return null;
		}

		@Override
		public Void visit(Conjunction conjunction) {
			for (Formula conjunct : conjunction.getConjuncts()) {
				conjunct.accept(this);
			}
			return null;
		}

		@Override
		public Void visit(Negation negation) {
			Formula negated = negation.getFormula();
			if (negated instanceof Negation) {
				((Negation) negated).getFormula().accept(this);
			} else if (negated instanceof Predicate) {
				addMessage((Predicate) negated, true);
			} else {
				throw fail("Cannot express the negation of a complex formula");
			}
			return null;
		}

		@Override
		public Void visit(Quantified quantified) {
			// forall x, y: f is parsed as forall x: forall y: f
			List<Quantified> chain = new ArrayList<Quantified>();
			Formula body = quantified;
			while (body instanceof Quantified) {
				chain.add((Quantified) body);
				body = ((Quantified) body).getBody();
			}
			List<Formula> remaining = new ArrayList<Formula>();
			flatten(body, remaining);

			Map<String, Entity> shadowed = new HashMap<String, Entity>();
			for (Quantified q : chain) {
				Variable variable = q.getVariable();
				Predicate grounding = findGrounding(variable, remaining);
				if (grounding == null) {
					throw fail("Quantified variable " + variable + " is not restricted by a unary predicate");
				}
				remaining.remove(grounding);
				Entity entity = registry.forVariable(variable, q.getQuantifier(), grounding);
				if (!shadowed.containsKey(variable.getName())) {
					shadowed.put(variable.getName(), scope.get(variable.getName()));
				}
				scope.put(variable.getName(), entity);
			}
			if (remaining.isEmpty()) {
				throw fail("Nothing is said about the quantified entities besides their class");
			}
			for (Formula formula : remaining) {
				formula.accept(this);
			}
			for (Map.Entry<String, Entity> e : shadowed.entrySet()) {
				if (e.getValue() == null) {
					scope.remove(e.getKey());
				} else {
					scope.put(e.getKey(), e.getValue());
				}
			}
			return null;
		}

		private Predicate findGrounding(Variable variable, List<Formula> conjuncts) {
			for (Formula conjunct : conjuncts) {
				if (conjunct instanceof Predicate) {
					Predicate p = (Predicate) conjunct;
					if (p.getArity() == 1 && variable.equals(p.getArgs().get(0))) {
						return p;
					}
				}
			}
			return null;
		}

		private void flatten(Formula formula, List<Formula> conjuncts) {
			if (formula instanceof Conjunction) {
				for (Formula conjunct : ((Conjunction) formula).getConjuncts()) {
					flatten(conjunct, conjuncts);
				}
			} else {
				conjuncts.add(formula);
			}
		}

		private void addMessage(Predicate predicate, boolean negated) {
			List<Entity> arguments = new ArrayList<Entity>();
			for (Term term : predicate.getArgs()) {
				if (term instanceof Constant) {
					arguments.add(registry.forConstant((Constant) term));
				} else {
					Entity entity = scope.get(term.getName());
					if (entity == null) {
						throw fail("Variable " + term + " is not bound by a quantifier");
					}
					arguments.add(entity);
				}
			}
			messages.add(new Message(predicate.getName(), arguments, negated, RhetoricalRelation.NUCLEUS,
					formulaIndex, topLevel));
		}

		private ContentException fail(String reason) {
			ContentException e = new ContentException(reason, topLevel);
			logger.error(e.getMessage());
			return e;
		}
	}
}
