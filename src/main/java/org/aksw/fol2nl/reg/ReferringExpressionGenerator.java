package org.aksw.fol2nl.reg;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import org.aksw.fol2nl.GenerationWarning;
import org.aksw.fol2nl.lexicon.GrammaticalNumber;
import org.aksw.fol2nl.semantics.Entity;
import org.aksw.fol2nl.syntax.Category;
import org.aksw.fol2nl.syntax.Feature;
import org.aksw.fol2nl.syntax.ReferringForm;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodes;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;

/**
 * Chooses how every entity mention in a syntax tree is expressed: a full noun
 * phrase the first time, afterwards a pronoun where the pronoun cannot be
 * mistaken for another recently mentioned entity, otherwise a definite
 * description.
 *
 * <p>Mentions are visited depth-first, left to right, and the tree is
 * modified in place.</p>
 */
public class ReferringExpressionGenerator {

    private static final Logger logger = Logger.getLogger(ReferringExpressionGenerator.class.getName());

    private int ambiguityWindow = 1;
    private boolean pronominalise = true;

    /**
     * The number of mentions of other entities that may come between an entity
     * and a pronoun referring to it (default 1). None of the last
     * <code>ambiguityWindow + 1</code> mentions may be a different entity of
     * the same gender and number.
     */
    public void setAmbiguityWindow(int ambiguityWindow) {
        Preconditions.checkArgument(ambiguityWindow >= 0, "ambiguity window must not be negative");
        this.ambiguityWindow = ambiguityWindow;
    }

    public int getAmbiguityWindow() {
        return ambiguityWindow;
    }

    /**
     * Whether repeated mentions may become personal pronouns (default true).
     */
    public void setPronominalise(boolean pronominalise) {
        this.pronominalise = pronominalise;
    }

    public boolean isPronominalise() {
        return pronominalise;
    }

    /**
     * Assigns a referring form to every mention in the tree.
     *
     * @param root the tree, modified in place
     * @param state the discourse history so far; updated and returned
     * @return the given state
     */
    public DiscourseState generateReferences(SyntaxNode root, DiscourseState state) {
        Multiset<String> classSizes = HashMultiset.create();
        Set<Entity> referents = Collections.newSetFromMap(new IdentityHashMap<Entity, Boolean>());
        for (SyntaxNode mention : SyntaxNodes.mentions(root)) {
            Entity entity = mention.getReferent();
            if (referents.add(entity)) {
                classSizes.add(entity.getSemanticClass());
            }
        }
        new Walker(state, classSizes).walk(root, null, false);
        logger.debug("Referring expressions chosen: " + root);
        return state;
    }

    private class Walker {

        private final DiscourseState state;
        private final Multiset<String> classSizes;

        Walker(DiscourseState state, Multiset<String> classSizes) {
            this.state = state;
            this.classSizes = classSizes;
        }

        void walk(SyntaxNode node, Entity clauseSubject, boolean subjectPosition) {
            if (node.is(Category.CLAUSE)) {
                List<SyntaxNode> children = node.getChildren();
                SyntaxNode subject = children.get(0);
                Entity subjectEntity = subject.is(Category.NOUN_PHRASE) ? subject.getReferent() : null;
                walk(subject, subjectEntity, true);
                for (int i = 1; i < children.size(); i++) {
                    walk(children.get(i), subjectEntity, false);
                }
                return;
            }
            if (node.is(Category.NOUN_PHRASE) && node.hasReferent()) {
                refer(node, clauseSubject, subjectPosition);
            }
            for (SyntaxNode child : node.getChildren()) {
                walk(child, clauseSubject, subjectPosition);
            }
        }

        private void refer(SyntaxNode np, Entity clauseSubject, boolean subjectPosition) {
            Entity entity = np.getReferent();
            ReferringForm form;
            if (!state.isMentioned(entity)) {
                fullForm(np, entity);
                form = ReferringForm.FULL;
            } else if (!subjectPosition && entity == clauseSubject && Pronouns.hasPronoun(entity.getGender())) {
                pronoun(np, Pronouns.reflexive(entity.getGender(), entity.getNumber()));
                np.setFeature(Feature.REFLEXIVE, Boolean.TRUE);
                form = ReferringForm.PRONOUN;
            } else if (pronominalise && canPronominalise(entity)) {
                pronoun(np, Pronouns.personal(entity.getGender(), entity.getNumber(), subjectPosition));
                form = ReferringForm.PRONOUN;
            } else {
                definiteForm(np, entity);
                form = ReferringForm.DEFINITE;
            }
            state.recordMention(entity, form);
        }

        private boolean canPronominalise(Entity entity) {
            if (!Pronouns.hasPronoun(entity.getGender())) {
                return false;
            }
            List<Entity> history = state.getHistory();
            int intervening = history.size() - 1 - history.lastIndexOf(entity);
            if (intervening > ambiguityWindow) {
                return false;
            }
            int from = Math.max(0, history.size() - (ambiguityWindow + 1));
            for (Entity recent : history.subList(from, history.size())) {
                if (recent != entity && recent.agreesWith(entity)) {
                    return false;
                }
            }
            return true;
        }

        private void fullForm(SyntaxNode np, Entity entity) {
            np.setFeature(Feature.REFERRING_FORM, ReferringForm.FULL);
            boolean plural = entity.getNumber() == GrammaticalNumber.PLURAL;
            String determiner;
            if (entity.isProper()) {
                determiner = null;
            } else {
                switch (entity.getQuantification()) {
                case UNIVERSAL:
                    determiner = plural ? "all" : "every";
                    break;
                case EXISTENTIAL:
                    determiner = plural ? null : "a";
                    break;
                default:
                    if (classSizes.count(entity.getSemanticClass()) == 1) {
                        determiner = "the";
                    } else {
                        determiner = plural ? null : "a";
                    }
                }
            }
            np.setFeature(Feature.DETERMINER, determiner);
        }

        private void definiteForm(SyntaxNode np, Entity entity) {
            np.setFeature(Feature.REFERRING_FORM, ReferringForm.DEFINITE);
            if (entity.isProper()) {
                np.removeFeature(Feature.DETERMINER);
                return;
            }
            if (!entity.getSemanticClass().equals(np.getHead())) {
                np.setHead(entity.getSemanticClass());
                np.removeFeature(Feature.IRREGULAR_FORMS);
            }
            np.setFeature(Feature.DETERMINER, "the");
            for (Entity other : state.getMentionedEntities()) {
                if (other != entity && !other.isProper() && other.getSemanticClass().equals(entity.getSemanticClass())
                        && other.getNumber() == entity.getNumber()) {
                    String description = SyntaxNodes.surfaceForm(np);
                    logger.warn("'" + description + "' may refer to " + entity.getName() + " or " + other.getName());
                    state.addWarning(new GenerationWarning(GenerationWarning.Type.REFERENCE_AMBIGUITY,
                            entity.getName(), "'" + description + "' may refer to " + entity.getName() + " or "
                                    + other.getName()));
                    break;
                }
            }
        }

        private void pronoun(SyntaxNode np, String pronoun) {
            np.setHead(pronoun);
            np.setFeature(Feature.PRONOUN, Boolean.TRUE);
            np.setFeature(Feature.REFERRING_FORM, ReferringForm.PRONOUN);
            np.removeFeature(Feature.DETERMINER);
            np.removeFeature(Feature.IRREGULAR_FORMS);
            np.getChildren().clear();
        }
    }
}
