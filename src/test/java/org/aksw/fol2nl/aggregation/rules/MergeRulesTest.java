package org.aksw.fol2nl.aggregation.rules;

import static org.aksw.fol2nl.syntax.SyntaxFactory.*;
import static org.junit.Assert.*;

import org.aksw.fol2nl.lexicon.GrammaticalNumber;
import org.aksw.fol2nl.lexicon.gender.Gender;
import org.aksw.fol2nl.semantics.Entity;
import org.aksw.fol2nl.semantics.Quantification;
import org.aksw.fol2nl.syntax.Feature;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodes;
import org.junit.Test;

public class MergeRulesTest {

	private final Entity mike = entity("Mike");
	private final Entity john = entity("John");
	private final Entity apples = entity("apples");
	private final Entity bananas = entity("bananas");

	private static Entity entity(String name) {
		return new Entity(name, name, Gender.UNKNOWN, GrammaticalNumber.SINGULAR, name, true, Quantification.NONE);
	}

	private static SyntaxNode np(Entity entity) {
		SyntaxNode np = nounPhrase(entity.getName());
		np.setReferent(entity);
		return np;
	}

	private SyntaxNode likes(Entity subject, Entity object) {
		return clause(np(subject), verbPhrase("like", np(object)));
	}

	@Test
	public void testObjectMerge() {
		Rule rule = new ObjectMergeRule();
		assertTrue(rule.isApplicable(likes(mike, apples), likes(mike, bananas)));
		assertFalse(rule.isApplicable(likes(mike, apples), likes(john, bananas)));
		assertFalse(rule.isApplicable(likes(mike, apples), likes(mike, apples)));
		SyntaxNode merged = rule.apply(likes(mike, apples), likes(mike, bananas));
		assertEquals("Mike like apples and bananas", SyntaxNodes.surfaceForm(merged));
	}

	@Test
	public void testObjectMergeNeedsSamePolarity() {
		SyntaxNode negated = likes(mike, bananas);
		negated.getPredicate().setFeature(Feature.NEGATED, Boolean.TRUE);
		assertFalse(new ObjectMergeRule().isApplicable(likes(mike, apples), negated));
	}

	@Test
	public void testSubjectMerge() {
		Rule rule = new SubjectMergeRule();
		assertTrue(rule.isApplicable(likes(mike, apples), likes(mike, bananas)));
		assertFalse(rule.isApplicable(likes(mike, apples), likes(mike, apples)));
		assertFalse(rule.isApplicable(likes(mike, apples), likes(john, bananas)));
		assertEquals("Mike like apples and like bananas",
				SyntaxNodes.surfaceForm(rule.apply(likes(mike, apples), likes(mike, bananas))));
	}

	@Test
	public void testPredicateMerge() {
		Rule rule = new PredicateMergeRule();
		assertTrue(rule.isApplicable(likes(mike, apples), likes(john, apples)));
		assertFalse(rule.isApplicable(likes(mike, apples), likes(john, bananas)));
		assertEquals("Mike and John like apples",
				SyntaxNodes.surfaceForm(rule.apply(likes(mike, apples), likes(john, apples))));
	}
}
