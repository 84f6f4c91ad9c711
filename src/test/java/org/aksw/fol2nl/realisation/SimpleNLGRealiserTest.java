package org.aksw.fol2nl.realisation;

import static org.aksw.fol2nl.syntax.SyntaxFactory.*;
import static org.junit.Assert.*;

import org.aksw.fol2nl.RealisationException;
import org.aksw.fol2nl.syntax.Feature;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class SimpleNLGRealiserTest {

	private final Realiser realiser = new SimpleNLGRealiser();

	private static SyntaxNode name(String name) {
		return nounPhrase(name).setFeature(Feature.PROPER, Boolean.TRUE);
	}

	private static SyntaxNode the(String noun) {
		return nounPhrase(noun).setFeature(Feature.DETERMINER, "the");
	}

	@Test
	public void testCoordinatedSubject() {
		SyntaxNode clause = clause(coordinated("and", name("John"), name("Paul")), verbPhrase("play", the("guitar")));
		assertEquals("John and Paul play the guitar.", realiser.realise(clause));
	}

	@Test
	public void testSentencesAreJoined() {
		SyntaxNode document = document(ImmutableList.of(
				paragraph(ImmutableList.of(clause(name("George"), verbPhrase("play", the("bass"))))),
				paragraph(ImmutableList.of(clause(name("Ringo"), verbPhrase("sing"))))));
		assertEquals("George plays the bass. Ringo sings.", realiser.realise(document));
	}

	@Test
	public void testNegation() {
		SyntaxNode clause = clause(name("John"), verbPhrase("sing").setFeature(Feature.NEGATED, Boolean.TRUE));
		assertEquals("John does not sing.", realiser.realise(clause));
	}

	@Test
	public void testCannedText() {
		assertEquals("It rains.", realiser.realise(cannedClause("it rains")));
	}

	@Test(expected = RealisationException.class)
	public void testUnboundPlaceholder() {
		realiser.realise(clause(placeholder(0), verbPhrase("sing")));
	}
}
