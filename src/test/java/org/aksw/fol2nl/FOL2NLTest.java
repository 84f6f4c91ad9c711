package org.aksw.fol2nl;

import static org.aksw.fol2nl.syntax.SyntaxFactory.clause;
import static org.aksw.fol2nl.syntax.SyntaxFactory.placeholder;
import static org.aksw.fol2nl.syntax.SyntaxFactory.verbPhrase;
import static org.junit.Assert.*;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.aksw.fol2nl.lexicalisation.TemplateSet;
import org.aksw.fol2nl.lexicon.Inflection;
import org.aksw.fol2nl.lexicon.LexicalEntry;
import org.aksw.fol2nl.lexicon.Lexicon;
import org.aksw.fol2nl.realisation.Realiser;
import org.aksw.fol2nl.realisation.SimpleNLGRealiser;
import org.aksw.fol2nl.semantics.Formula;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodes;
import org.junit.Test;

public class FOL2NLTest {

	private final FOL2NL fol2nl = new FOL2NL();
	private final Lexicon lexicon = BeatlesFixtures.lexicon();
	private final TemplateSet templates = BeatlesFixtures.templates();

	@Test
	public void testBeatles() throws ParseException {
		String text = fol2nl.realise(BeatlesFixtures.BEATLES, templates, lexicon, new SimpleNLGRealiser());
		assertEquals(BeatlesFixtures.BEATLES_TEXT, text);
	}

	@Test
	public void testBeatlesWithConjunction() throws ParseException {
		String text = fol2nl.realise("Play(john, guitar) & Play(paul, guitar); Play(george, bass); Play(ringo, drums)",
				templates, lexicon, new SimpleNLGRealiser());
		assertEquals(BeatlesFixtures.BEATLES_TEXT, text);
	}

	@Test
	public void testIrregularVerbFromLexicon() throws ParseException {
		Lexicon blickLexicon = Lexicon.builder()
				.addAll(lexicon.getEntries())
				.add(LexicalEntry.verb("blick", "blick").withIrregularForm(Inflection.PRESENT3S, "blacks"))
				.build();
		TemplateSet blickTemplates = TemplateSet.builder()
				.add("Blick", clause(placeholder(0), verbPhrase("blick")))
				.build();
		String text = fol2nl.realise("Blick(john)", blickTemplates, blickLexicon, new SimpleNLGRealiser());
		assertEquals("John blacks.", text);
	}

	@Test
	public void testExtraArgumentsAreNotDropped() throws ParseException {
		GenerationResult result = fol2nl.realiseText("Sing(john, guitar)", templates, lexicon);
		assertEquals(1, result.getWarnings().size());
		assertEquals("Sing", result.getWarnings().get(0).getKey());
		assertEquals("John Sing the guitar", SyntaxNodes.surfaceForm(result.getTree()));
	}

	@Test
	public void testLexiconIsRequired() throws ParseException {
		try {
			fol2nl.realiseText("Sing(john)", templates, null);
			fail("expected a missing lexicon to be rejected");
		} catch (NullPointerException e) {
			assertEquals("lexicon must not be null", e.getMessage());
		}
	}

	@Test
	public void testBeatlesTree() throws ParseException {
		GenerationResult result = fol2nl.realiseText(BeatlesFixtures.BEATLES, templates, lexicon);
		assertFalse(result.hasWarnings());
		SyntaxNode tree = result.getTree();
		assertEquals(3, tree.getChildren().size());
		assertEquals("John and Paul play the guitar George play the bass Ringo play the drum",
				SyntaxNodes.surfaceForm(tree));
	}

	@Test
	public void testQuantifierWithoutStatementIsFatal() throws ParseException {
		try {
			fol2nl.realiseText("Sing(john); exists x: Bark(x)", templates, lexicon);
			fail("expected a content error");
		} catch (ContentException e) {
			assertEquals("exists x: Bark(x)", e.getFormula().toString());
		}
	}

	@Test
	public void testLexicalGapIsReported() throws ParseException {
		GenerationResult result = fol2nl.realiseText("Dance(john)", templates, lexicon);
		assertEquals(1, result.getWarnings().size());
		GenerationWarning warning = result.getWarnings().get(0);
		assertEquals(GenerationWarning.Type.LEXICAL_GAP, warning.getType());
		assertEquals("Dance", warning.getKey());
		assertEquals("John Dance", SyntaxNodes.surfaceForm(result.getTree()));
	}

	@Test
	public void testPronoun() throws ParseException {
		String text = fol2nl.realise("Sing(yoko); Happy(yoko)", templates, lexicon, new SimpleNLGRealiser());
		assertTrue(text, text.startsWith("Yoko sings."));
	}

	@Test
	public void testRealisationErrorsPropagate() throws ParseException {
		Realiser failing = new Realiser() {

			@Override
			public String realise(SyntaxNode root) {
				throw new RealisationException("no realiser");
			}
		};
		try {
			fol2nl.realise("Sing(john)", templates, lexicon, failing);
			fail("expected a realisation error");
		} catch (RealisationException e) {
			assertEquals("no realiser", e.getMessage());
		}
	}

	@Test(expected = ParseException.class)
	public void testParseErrorsPropagate() throws ParseException {
		fol2nl.realiseText("Sing(john", templates, lexicon);
	}

	@Test
	public void testConcurrentRequests() throws Exception {
		final Realiser realiser = new SimpleNLGRealiser();
		final List<Formula> formulas = BeatlesFixtures.parse(BeatlesFixtures.BEATLES);
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<String>> futures = new ArrayList<Future<String>>();
			for (int i = 0; i < 20; i++) {
				futures.add(executor.submit(new Callable<String>() {

					@Override
					public String call() {
						return fol2nl.realise(formulas, templates, lexicon, realiser);
					}
				}));
			}
			for (Future<String> future : futures) {
				assertEquals(BeatlesFixtures.BEATLES_TEXT, future.get());
			}
		} finally {
			executor.shutdown();
		}
	}
}
