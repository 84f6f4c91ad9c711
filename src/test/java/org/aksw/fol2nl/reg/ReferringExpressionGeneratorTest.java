package org.aksw.fol2nl.reg;

import static org.aksw.fol2nl.BeatlesFixtures.parse;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.aksw.fol2nl.BeatlesFixtures;
import org.aksw.fol2nl.GenerationWarning;
import org.aksw.fol2nl.lexicalisation.Lexicaliser;
import org.aksw.fol2nl.lexicon.Lexicon;
import org.aksw.fol2nl.macroplanning.DocumentPlan;
import org.aksw.fol2nl.macroplanning.Macroplanner;
import org.aksw.fol2nl.syntax.Feature;
import org.aksw.fol2nl.syntax.ReferringForm;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodes;
import org.junit.Test;

public class ReferringExpressionGeneratorTest {

    private final Lexicon lexicon = BeatlesFixtures.lexicon();
    private final ReferringExpressionGenerator reg = new ReferringExpressionGenerator();
    private DiscourseState state;

    /**
     * @return the surface forms of all mentions, in order
     */
    private List<String> refer(String input) {
        Macroplanner macroplanner = new Macroplanner(lexicon);
        macroplanner.setGroupRelatedMessages(false);
        DocumentPlan plan = macroplanner.plan(parse(input));
        SyntaxNode tree = new Lexicaliser().lexicalise(plan, BeatlesFixtures.templates(), lexicon);
        state = reg.generateReferences(tree, new DiscourseState());
        List<String> forms = new ArrayList<String>();
        for (SyntaxNode mention : SyntaxNodes.mentions(tree)) {
            forms.add(SyntaxNodes.surfaceForm(mention));
        }
        return forms;
    }

    @Test
    public void testFirstMentions() {
        assertEquals("[John, the guitar]", refer("Play(john, guitar)").toString());
        assertEquals("[a dog, a dog]", refer("Bark(rex); Bark(fido)").toString());
        assertEquals("[the drum]", refer("Bark(drums)").toString());
        assertEquals("[every dog]", refer("forall x: Dog(x) & Bark(x)").toString());
        assertEquals("[a dog]", refer("exists x: Dog(x) & Bark(x)").toString());
    }

    @Test
    public void testPronounAfterMention() {
        assertEquals("[Yoko, she]", refer("Sing(yoko); Sing(yoko)").toString());
        assertEquals("[John, Yoko, him]", refer("Sing(john); Like(yoko, john)").toString());
        assertEquals(ReferringForm.PRONOUN, state.getRecord(state.getHistory().get(0)).getLastForm());
    }

    @Test
    public void testNoPronounForSameGenderDistractor() {
        List<String> forms = refer("Like(john, paul); Sing(paul)");
        assertEquals("[John, Paul, Paul]", forms.toString());
    }

    @Test
    public void testNoPronounWithoutGender() {
        assertEquals("[John, the guitar, Paul, the guitar]",
                refer("Play(john, guitar); Play(paul, guitar)").toString());
    }

    @Test
    public void testReflexive() {
        assertEquals("[John, himself]", refer("Like(john, john)").toString());
    }

    @Test
    public void testAmbiguityWindow() {
        reg.setAmbiguityWindow(0);
        assertEquals("[John, Yoko, John]", refer("Sing(john); Like(yoko, john)").toString());
        assertEquals("[Yoko, she]", refer("Sing(yoko); Sing(yoko)").toString());
    }

    @Test
    public void testPronominalisationDisabled() {
        reg.setPronominalise(false);
        assertEquals("[Yoko, Yoko]", refer("Sing(yoko); Sing(yoko)").toString());
    }

    @Test
    public void testAmbiguousDefiniteDescription() {
        assertEquals("[a dog, a dog, the dog]", refer("Bark(rex); Bark(fido); Bark(rex)").toString());
        List<GenerationWarning> warnings = state.getWarnings();
        assertEquals(1, warnings.size());
        assertEquals(GenerationWarning.Type.REFERENCE_AMBIGUITY, warnings.get(0).getType());
        assertEquals("rex", warnings.get(0).getKey());
    }

    @Test
    public void testDiscourseState() {
        refer(BeatlesFixtures.BEATLES);
        assertEquals(8, state.getPosition());
        assertEquals(7, state.getMentionedEntities().size());
        MentionRecord guitar = state.getRecord(state.getHistory().get(1));
        assertEquals(2, guitar.getCount());
        assertEquals(3, guitar.getLastPosition());
        assertEquals(ReferringForm.DEFINITE, guitar.getLastForm());
    }

    @Test
    public void testPronounFeatures() {
        Macroplanner macroplanner = new Macroplanner(lexicon);
        DocumentPlan plan = macroplanner.plan(parse("Sing(yoko); Sing(yoko)"));
        SyntaxNode tree = new Lexicaliser().lexicalise(plan, BeatlesFixtures.templates(), lexicon);
        reg.generateReferences(tree, new DiscourseState());
        SyntaxNode she = SyntaxNodes.mentions(tree).get(1);
        assertTrue(she.isFeature(Feature.PRONOUN));
        assertFalse(she.hasFeature(Feature.DETERMINER));
    }
}
