package org.aksw.fol2nl.realisation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.aksw.fol2nl.RealisationException;
import org.aksw.fol2nl.lexicon.GrammaticalNumber;
import org.aksw.fol2nl.lexicon.Inflection;
import org.aksw.fol2nl.syntax.Category;
import org.aksw.fol2nl.syntax.Feature;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodeVisitor;
import org.aksw.fol2nl.syntax.Tense;
import org.apache.log4j.Logger;

import com.google.common.base.Joiner;

import simplenlg.features.Gender;
import simplenlg.features.LexicalFeature;
import simplenlg.framework.CoordinatedPhraseElement;
import simplenlg.framework.InflectedWordElement;
import simplenlg.framework.LexicalCategory;
import simplenlg.framework.NLGElement;
import simplenlg.framework.NLGFactory;
import simplenlg.framework.WordElement;
import simplenlg.lexicon.Lexicon;
import simplenlg.phrasespec.AdjPhraseSpec;
import simplenlg.phrasespec.NPPhraseSpec;
import simplenlg.phrasespec.SPhraseSpec;
import simplenlg.phrasespec.VPPhraseSpec;

/**
 * {@link Realiser} on top of SimpleNLG. Every clause is realised as one
 * sentence; sentences are separated by a single space.
 *
 * <p>The SimpleNLG lexicon is loaded once and only read afterwards. Factory
 * and realiser are created per call, so an instance can be shared by
 * concurrent requests.</p>
 */
public class SimpleNLGRealiser implements Realiser {

    private static final Logger logger = Logger.getLogger(SimpleNLGRealiser.class.getName());

    private final Lexicon lexicon;

    public SimpleNLGRealiser() {
        this(Lexicon.getDefaultLexicon());
    }

    public SimpleNLGRealiser(Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public String realise(SyntaxNode root) {
        NLGFactory nlgFactory = new NLGFactory(lexicon);
        simplenlg.realiser.english.Realiser realiser = new simplenlg.realiser.english.Realiser(lexicon);
        List<SyntaxNode> clauses = new ArrayList<SyntaxNode>();
        collectClauses(root, clauses);

        List<String> sentences = new ArrayList<String>();
        try {
            Converter converter = new Converter(nlgFactory, realiser);
            for (SyntaxNode clause : clauses) {
                sentences.add(realiser.realiseSentence(clause.accept(converter)));
            }
        } catch (RealisationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RealisationException("SimpleNLG failed to realise " + root, e);
        }
        String text = Joiner.on(' ').join(sentences);
        logger.debug("Realised: " + text);
        return text;
    }

    private void collectClauses(SyntaxNode node, List<SyntaxNode> clauses) {
        if (node.is(Category.CLAUSE)) {
            clauses.add(node);
        } else if (node.is(Category.DOCUMENT) || node.is(Category.PARAGRAPH)) {
            for (SyntaxNode child : node.getChildren()) {
                collectClauses(child, clauses);
            }
        } else {
            throw new RealisationException("Cannot realise a " + node.getCategory() + " as text: " + node);
        }
    }

    /**
     * Maps syntax nodes to SimpleNLG elements.
     */
    private class Converter implements SyntaxNodeVisitor<NLGElement> {

        private final NLGFactory nlgFactory;
        private final simplenlg.realiser.english.Realiser realiser;

        Converter(NLGFactory nlgFactory, simplenlg.realiser.english.Realiser realiser) {
            this.nlgFactory = nlgFactory;
            this.realiser = realiser;
        }

        @Override
        public NLGElement visitDocument(SyntaxNode document) {
            throw new RealisationException("Nested document: " + document);
        }

        @Override
        public NLGElement visitParagraph(SyntaxNode paragraph) {
            throw new RealisationException("Nested paragraph: " + paragraph);
        }

        @Override
        public NLGElement visitClause(SyntaxNode clause) {
            List<SyntaxNode> children = clause.getChildren();
            for (SyntaxNode child : children) {
                if (child.isLiteralPlaceholder()) {
                    return cannedText(children);
                }
            }
            SPhraseSpec s = nlgFactory.createClause();
            s.setSubject(clause.getSubject().accept(this));
            SyntaxNode predicate = clause.getPredicate();
            if (predicate != null) {
                s.setVerbPhrase(predicate.accept(this));
                if (predicate.is(Category.VERB_PHRASE)) {
                    if (predicate.isFeature(Feature.NEGATED)) {
                        s.setFeature(simplenlg.features.Feature.NEGATED, true);
                    }
                    if (predicate.hasFeature(Feature.TENSE)) {
                        s.setFeature(simplenlg.features.Feature.TENSE, tense(predicate));
                    }
                }
            }
            return s;
        }

        /**
         * A clause with literal text: the other constituents are realised on
         * their own and joined around it.
         */
        private NLGElement cannedText(List<SyntaxNode> children) {
            List<String> parts = new ArrayList<String>();
            for (SyntaxNode child : children) {
                if (child.isLiteralPlaceholder()) {
                    parts.add(child.getHead());
                } else {
                    parts.add(realiser.realise(child.accept(this)).getRealisation());
                }
            }
            return nlgFactory.createStringElement(Joiner.on(' ').join(parts));
        }

        @Override
        public NLGElement visitNounPhrase(SyntaxNode nounPhrase) {
            NPPhraseSpec np = nlgFactory.createNounPhrase();
            boolean plural = nounPhrase.getFeature(Feature.NUMBER) == GrammaticalNumber.PLURAL;
            if (nounPhrase.isFeature(Feature.PRONOUN)) {
                np.setFeature(simplenlg.features.Feature.PRONOMINAL, true);
                if (nounPhrase.isFeature(Feature.REFLEXIVE)) {
                    np.setFeature(LexicalFeature.REFLEXIVE, true);
                }
            } else {
                np.setHead(new InflectedWordElement(headWord(nounPhrase)));
                if (nounPhrase.hasFeature(Feature.DETERMINER)) {
                    np.setDeterminer(nounPhrase.getFeature(Feature.DETERMINER, String.class));
                }
                for (SyntaxNode modifier : nounPhrase.getChildren()) {
                    if (modifier.is(Category.ADJECTIVE_PHRASE)) {
                        np.addPreModifier(modifier.accept(this));
                    } else {
                        np.addPostModifier(modifier.accept(this));
                    }
                }
            }
            Object gender = gender(nounPhrase);
            if (gender != null) {
                np.setFeature(LexicalFeature.GENDER, gender);
            }
            np.setPlural(plural);
            return np;
        }

        private WordElement headWord(SyntaxNode nounPhrase) {
            String head = nounPhrase.getHead();
            if (nounPhrase.isFeature(Feature.PROPER)) {
                WordElement word = new WordElement(head, LexicalCategory.NOUN);
                word.setFeature(LexicalFeature.PROPER, true);
                return word;
            }
            Map<?, ?> irregular = nounPhrase.getFeature(Feature.IRREGULAR_FORMS, Map.class);
            if (irregular != null && irregular.containsKey(Inflection.PLURAL)) {
                // never change the words of the shared lexicon
                WordElement word = new WordElement(head, LexicalCategory.NOUN);
                word.setFeature(LexicalFeature.PLURAL, irregular.get(Inflection.PLURAL));
                return word;
            }
            return lexicon.lookupWord(head, LexicalCategory.NOUN);
        }

        private Object gender(SyntaxNode nounPhrase) {
            Object gender = nounPhrase.getFeature(Feature.GENDER);
            if (gender == org.aksw.fol2nl.lexicon.gender.Gender.MALE) {
                return Gender.MASCULINE;
            } else if (gender == org.aksw.fol2nl.lexicon.gender.Gender.FEMALE) {
                return Gender.FEMININE;
            } else if (gender == org.aksw.fol2nl.lexicon.gender.Gender.NEUTER) {
                return Gender.NEUTER;
            }
            return null;
        }

        @Override
        public NLGElement visitVerbPhrase(SyntaxNode verbPhrase) {
            VPPhraseSpec vp = nlgFactory.createVerbPhrase();
            Map<?, ?> irregular = verbPhrase.getFeature(Feature.IRREGULAR_FORMS, Map.class);
            if (irregular != null && !irregular.isEmpty()) {
                WordElement verb = new WordElement(verbPhrase.getHead(), LexicalCategory.VERB);
                setIfPresent(verb, LexicalFeature.PAST, irregular.get(Inflection.PAST));
                setIfPresent(verb, LexicalFeature.PAST_PARTICIPLE, irregular.get(Inflection.PAST_PARTICIPLE));
                setIfPresent(verb, LexicalFeature.PRESENT_PARTICIPLE, irregular.get(Inflection.PRESENT_PARTICIPLE));
                setIfPresent(verb, LexicalFeature.PRESENT3S, irregular.get(Inflection.PRESENT3S));
                vp.setVerb(verb);
            } else {
                vp.setVerb(verbPhrase.getHead());
            }
            for (SyntaxNode complement : verbPhrase.getChildren()) {
                vp.addComplement(complement.accept(this));
            }
            if (verbPhrase.isFeature(Feature.NEGATED)) {
                vp.setFeature(simplenlg.features.Feature.NEGATED, true);
            }
            if (verbPhrase.hasFeature(Feature.TENSE)) {
                vp.setFeature(simplenlg.features.Feature.TENSE, tense(verbPhrase));
            }
            return vp;
        }

        private void setIfPresent(WordElement word, String feature, Object value) {
            if (value != null) {
                word.setFeature(feature, value);
            }
        }

        private simplenlg.features.Tense tense(SyntaxNode verbPhrase) {
            Tense tense = verbPhrase.getFeature(Feature.TENSE, Tense.class);
            return simplenlg.features.Tense.valueOf(tense.name());
        }

        @Override
        public NLGElement visitAdjectivePhrase(SyntaxNode adjectivePhrase) {
            AdjPhraseSpec adj = nlgFactory.createAdjectivePhrase(adjectivePhrase.getHead());
            for (SyntaxNode modifier : adjectivePhrase.getChildren()) {
                adj.addPostModifier(modifier.accept(this));
            }
            return adj;
        }

        @Override
        public NLGElement visitCoordinatedPhrase(SyntaxNode coordinatedPhrase) {
            CoordinatedPhraseElement coordination = nlgFactory.createCoordinatedPhrase();
            for (SyntaxNode coordinate : coordinatedPhrase.getChildren()) {
                coordination.addCoordinate(coordinate.accept(this));
            }
            if (coordinatedPhrase.hasFeature(Feature.CONJUNCTION)) {
                coordination.setConjunction(coordinatedPhrase.getFeature(Feature.CONJUNCTION, String.class));
            }
            return coordination;
        }

        @Override
        public NLGElement visitPlaceholder(SyntaxNode placeholder) {
            if (placeholder.isLiteralPlaceholder()) {
                return nlgFactory.createStringElement(placeholder.getHead());
            }
            throw new RealisationException("Unbound placeholder #" + placeholder.getPlaceholderIndex());
        }
    }
}
