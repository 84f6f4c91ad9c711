package org.aksw.fol2nl.lexicalisation;

import static org.aksw.fol2nl.BeatlesFixtures.parse;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.aksw.fol2nl.BeatlesFixtures;
import org.aksw.fol2nl.GenerationWarning;
import org.aksw.fol2nl.lexicon.GrammaticalNumber;
import org.aksw.fol2nl.lexicon.Inflection;
import org.aksw.fol2nl.lexicon.LexicalEntry;
import org.aksw.fol2nl.lexicon.Lexicon;
import org.aksw.fol2nl.lexicon.gender.Gender;
import org.aksw.fol2nl.macroplanning.DocumentPlan;
import org.aksw.fol2nl.macroplanning.Macroplanner;
import org.aksw.fol2nl.syntax.Category;
import org.aksw.fol2nl.syntax.Feature;
import org.aksw.fol2nl.syntax.ReferringForm;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.junit.Test;

public class LexicaliserTest {

    private final Lexicon lexicon = BeatlesFixtures.lexicon();
    private final TemplateSet templates = BeatlesFixtures.templates();
    private final List<GenerationWarning> warnings = new ArrayList<GenerationWarning>();

    private SyntaxNode lexicalise(String input) {
        DocumentPlan plan = new Macroplanner(lexicon).plan(parse(input));
        return new Lexicaliser().lexicalise(plan, templates, lexicon, warnings);
    }

    @Test
    public void testDocumentShape() {
        SyntaxNode document = lexicalise(BeatlesFixtures.BEATLES);
        assertTrue(document.is(Category.DOCUMENT));
        assertEquals(3, document.getChildren().size());
        SyntaxNode paragraph = document.getChild(0);
        assertTrue(paragraph.is(Category.PARAGRAPH));
        assertEquals(2, paragraph.getChildren().size());
        assertTrue(paragraph.getChild(0).is(Category.CLAUSE));
        assertTrue(warnings.isEmpty());
    }

    @Test
    public void testPlaceholdersBecomeEntityNounPhrases() {
        SyntaxNode clause = lexicalise("Play(john, drums)").getChild(0).getChild(0);
        SyntaxNode john = clause.getSubject();
        assertTrue(john.is(Category.NOUN_PHRASE));
        assertEquals("John", john.getHead());
        assertEquals("john", john.getReferent().getName());
        assertEquals(Boolean.TRUE, john.getFeature(Feature.PROPER));
        assertEquals(Gender.MALE, john.getFeature(Feature.GENDER));
        assertEquals(ReferringForm.FULL, john.getFeature(Feature.REFERRING_FORM));
        assertFalse(john.hasFeature(Feature.DETERMINER));

        SyntaxNode drums = clause.getPredicate().getChild(0);
        assertEquals("drum", drums.getHead());
        assertEquals(GrammaticalNumber.PLURAL, drums.getFeature(Feature.NUMBER));
    }

    @Test
    public void testNegation() {
        SyntaxNode clause = lexicalise("~Sing(john)").getChild(0).getChild(0);
        assertTrue(clause.getPredicate().isFeature(Feature.NEGATED));
    }

    @Test
    public void testMissingTemplateFallsBackToLiteral() {
        SyntaxNode document = lexicalise("Dance(john, yoko); Dance(yoko, john)");
        assertEquals(1, warnings.size());
        assertEquals(GenerationWarning.Type.LEXICAL_GAP, warnings.get(0).getType());
        assertEquals("Dance", warnings.get(0).getKey());

        SyntaxNode clause = document.getChild(0).getChild(0);
        assertEquals(3, clause.getChildren().size());
        assertEquals("John", clause.getChild(0).getHead());
        assertTrue(clause.getChild(1).isLiteralPlaceholder());
        assertEquals("Dance", clause.getChild(1).getHead());
        assertEquals("Yoko", clause.getChild(2).getHead());
    }

    @Test
    public void testZeroArityFallback() {
        SyntaxNode clause = lexicalise("Rain").getChild(0).getChild(0);
        assertEquals(1, clause.getChildren().size());
        assertTrue(clause.getChild(0).isLiteralPlaceholder());
    }

    @Test
    public void testMissingEntityUsesName() {
        SyntaxNode clause = lexicalise("Sing(stranger)").getChild(0).getChild(0);
        SyntaxNode subject = clause.getSubject();
        assertEquals("stranger", subject.getHead());
        assertNotNull(subject.getReferent());
        assertEquals(1, warnings.size());
        assertEquals("stranger", warnings.get(0).getKey());
    }

    @Test
    public void testTemplateNeedsMoreArguments() {
        SyntaxNode clause = lexicalise("Play(john)").getChild(0).getChild(0);
        assertTrue(clause.getChild(1).isLiteralPlaceholder());
        assertEquals(GenerationWarning.Type.LEXICAL_GAP, warnings.get(0).getType());
    }

    @Test
    public void testTemplateTakesFewerArguments() {
        SyntaxNode clause = lexicalise("Sing(john, guitar)").getChild(0).getChild(0);
        assertEquals(3, clause.getChildren().size());
        assertTrue(clause.getChild(1).isLiteralPlaceholder());
        assertEquals("Sing", clause.getChild(1).getHead());
        assertEquals("guitar", clause.getChild(2).getHead());
        assertEquals(1, warnings.size());
        assertEquals(GenerationWarning.Type.LEXICAL_GAP, warnings.get(0).getType());
        assertEquals("Sing", warnings.get(0).getKey());
    }

    @Test
    public void testVerbAndAdjectiveWordsFromLexicon() {
        Lexicon lexicon = Lexicon.builder()
                .addAll(this.lexicon.getEntries())
                .add(LexicalEntry.verb("sing", "sing").withIrregularForm(Inflection.PAST, "sang"))
                .add(LexicalEntry.adjective("happy", "glad"))
                .add(LexicalEntry.noun("play", "game"))
                .build();
        DocumentPlan plan = new Macroplanner(lexicon).plan(parse("Sing(john); Happy(yoko); Play(ringo, drums)"));
        SyntaxNode document = new Lexicaliser().lexicalise(plan, templates, lexicon, warnings);
        assertTrue(warnings.isEmpty());

        SyntaxNode sing = document.getChild(0).getChild(0).getPredicate();
        assertEquals("sing", sing.getHead());
        Map<?, ?> forms = sing.getFeature(Feature.IRREGULAR_FORMS, Map.class);
        assertEquals("sang", forms.get(Inflection.PAST));

        SyntaxNode happy = document.getChild(1).getChild(0).getPredicate().getChild(0);
        assertTrue(happy.is(Category.ADJECTIVE_PHRASE));
        assertEquals("glad", happy.getHead());

        // a noun entry never replaces a verb
        SyntaxNode play = document.getChild(2).getChild(0).getPredicate();
        assertEquals("play", play.getHead());
        assertFalse(play.hasFeature(Feature.IRREGULAR_FORMS));
    }

    @Test(expected = NullPointerException.class)
    public void testLexiconIsRequired() {
        DocumentPlan plan = new Macroplanner(null).plan(parse("Sing(john)"));
        new Lexicaliser().lexicalise(plan, templates, null, warnings);
    }
}
