package org.aksw.fol2nl.macroplanning;

import static org.aksw.fol2nl.BeatlesFixtures.parse;
import static org.junit.Assert.*;

import java.util.List;

import org.aksw.fol2nl.BeatlesFixtures;
import org.aksw.fol2nl.ContentException;
import org.aksw.fol2nl.lexicon.gender.Gender;
import org.aksw.fol2nl.semantics.Constant;
import org.aksw.fol2nl.semantics.Entity;
import org.aksw.fol2nl.semantics.Formula;
import org.aksw.fol2nl.semantics.Predicate;
import org.aksw.fol2nl.semantics.Quantification;
import org.aksw.fol2nl.semantics.Variable;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class MacroplannerTest {

	private Macroplanner macroplanner;

	@Before
	public void setUp() {
		macroplanner = new Macroplanner(BeatlesFixtures.lexicon());
	}

	@Test
	public void testClustersBySharedEntities() {
		DocumentPlan plan = macroplanner.plan(parse(BeatlesFixtures.BEATLES));
		assertEquals(RhetoricalRelation.SEQUENCE, plan.getRelation());
		assertEquals(3, plan.getChildren().size());
		List<Message> first = plan.getChildren().get(0).getMessages();
		assertEquals(2, first.size());
		assertEquals("Play(john, guitar)", first.get(0).toString());
		assertEquals("Play(paul, guitar)", first.get(1).toString());
		assertEquals(RhetoricalRelation.NUCLEUS, first.get(0).getRelation());
		assertEquals(RhetoricalRelation.ELABORATION, first.get(1).getRelation());
		assertEquals(4, plan.getMessages().size());
	}

	@Test
	public void testOneEntityPerConstant() {
		DocumentPlan plan = macroplanner.plan(parse(BeatlesFixtures.BEATLES));
		List<Message> messages = plan.getMessages();
		assertSame(messages.get(0).getArgument(1), messages.get(1).getArgument(1));
		assertEquals(7, plan.getEntities().size());
		Entity john = messages.get(0).getArgument(0);
		assertEquals(Gender.MALE, john.getGender());
		assertTrue(john.isProper());
		assertEquals(Quantification.NONE, john.getQuantification());
	}

	@Test
	public void testTiesGoToEarliestCluster() {
		DocumentPlan plan = macroplanner.plan(parse("Sing(john); Sing(paul); Meet(yoko, john, paul)"));
		assertEquals(2, plan.getChildren().size());
		assertEquals("Sing(john); Meet(yoko, john, paul)",
				Message.toString(plan.getChildren().get(0).getMessages()));
	}

	@Test
	public void testSharedSubjectCountsDouble() {
		DocumentPlan plan = macroplanner.plan(parse("Sing(john); Like(paul, yoko); Like(yoko, john); Like(paul, john)"));
		// Like(paul, john) shares john with the first cluster and paul, as subject, with the second
		assertEquals("Like(paul, yoko); Like(paul, john)", Message.toString(plan.getChildren().get(1).getMessages()));
	}

	@Test
	public void testGroupingDisabled() {
		macroplanner.setGroupRelatedMessages(false);
		DocumentPlan plan = macroplanner.plan(parse(BeatlesFixtures.BEATLES));
		assertEquals(4, plan.getChildren().size());
	}

	@Test
	public void testFlattensConjunctionsAndDoubleNegation() {
		DocumentPlan plan = macroplanner.plan(parse("Sing(john) & (~Sing(paul) & ~~Sing(george))"));
		List<Message> messages = plan.getMessages();
		assertEquals(3, messages.size());
		assertFalse(messages.get(0).isNegated());
		assertTrue(messages.get(1).isNegated());
		assertFalse(messages.get(2).isNegated());
		assertEquals(0, messages.get(2).getFormulaIndex());
	}

	@Test
	public void testQuantifiedEntity() {
		DocumentPlan plan = macroplanner.plan(parse("exists x: Dog(x) & Bark(x) & Like(john, x)"));
		List<Message> messages = plan.getMessages();
		assertEquals("Bark(x); Like(john, x)", Message.toString(messages));
		Entity dog = messages.get(0).getArgument(0);
		assertSame(dog, messages.get(1).getArgument(1));
		assertEquals(Quantification.EXISTENTIAL, dog.getQuantification());
		assertEquals("dog", dog.getSemanticClass());
		assertEquals(Gender.NEUTER, dog.getGender());
		assertFalse(dog.isProper());
	}

	@Test
	public void testUnknownConstantGetsDefaults() {
		Entity stranger = macroplanner.plan(parse("Sing(stranger)")).getMessages().get(0).getArgument(0);
		assertEquals(Gender.UNKNOWN, stranger.getGender());
		assertEquals("stranger", stranger.getSemanticClass());
	}

	@Test
	public void testUngroundedQuantifier() {
		List<Formula> formulas = parse("Sing(john); exists x: Like(john, x)");
		try {
			macroplanner.plan(formulas);
			fail("expected a content error");
		} catch (ContentException e) {
			assertEquals(formulas.get(1), e.getFormula());
		}
	}

	@Test(expected = ContentException.class)
	public void testOnlyGroundingPredicate() {
		macroplanner.plan(parse("exists x: Bark(x)"));
	}

	@Test(expected = ContentException.class)
	public void testNegatedConjunction() {
		macroplanner.plan(parse("~(Sing(john) & Sing(paul))"));
	}

	@Test(expected = ContentException.class)
	public void testFreeVariable() {
		Formula formula = new Predicate("Like", new Constant("john"), new Variable("x"));
		macroplanner.plan(ImmutableList.of(formula));
	}
}
