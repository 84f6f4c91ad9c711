package org.aksw.fol2nl.lexicalisation;

import java.util.ArrayList;
import java.util.List;

import org.aksw.fol2nl.GenerationWarning;
import org.aksw.fol2nl.LexicalGapException;
import org.aksw.fol2nl.lexicon.LexicalEntry;
import org.aksw.fol2nl.lexicon.Lexicon;
import org.aksw.fol2nl.lexicon.PartOfSpeech;
import org.aksw.fol2nl.macroplanning.DocumentPlan;
import org.aksw.fol2nl.macroplanning.Message;
import org.aksw.fol2nl.macroplanning.PlanElement;
import org.aksw.fol2nl.semantics.Entity;
import org.aksw.fol2nl.semantics.Quantification;
import org.aksw.fol2nl.syntax.Category;
import org.aksw.fol2nl.syntax.Feature;
import org.aksw.fol2nl.syntax.ReferringForm;
import org.aksw.fol2nl.syntax.SyntaxFactory;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodes;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

/**
 * Turns a {@link DocumentPlan} into a syntax tree: one paragraph per cluster,
 * one clause per message. Each clause is a copy of the predicate's template
 * with its placeholders replaced by noun phrases for the message's entities.
 *
 * <p>Missing templates and lexicon entries do not abort lexicalisation. The
 * predicate name or entity name is used literally instead and a
 * {@link GenerationWarning.Type#LEXICAL_GAP} warning is recorded.</p>
 */
public class Lexicaliser {

    private static final Logger logger = Logger.getLogger(Lexicaliser.class.getName());

    public SyntaxNode lexicalise(DocumentPlan plan, TemplateSet templates, Lexicon lexicon) {
        return lexicalise(plan, templates, lexicon, new ArrayList<GenerationWarning>());
    }

    /**
     * @param warnings receives one warning per distinct lexical gap
     * @return a DOCUMENT node
     */
    public SyntaxNode lexicalise(DocumentPlan plan, TemplateSet templates, Lexicon lexicon,
            List<GenerationWarning> warnings) {
        Preconditions.checkNotNull(lexicon, "lexicon must not be null");
        List<SyntaxNode> paragraphs = new ArrayList<SyntaxNode>();
        for (PlanElement cluster : plan.getChildren()) {
            List<SyntaxNode> clauses = new ArrayList<SyntaxNode>();
            for (Message message : cluster.getMessages()) {
                clauses.add(lexicalise(message, templates, lexicon, warnings));
            }
            paragraphs.add(SyntaxFactory.paragraph(clauses));
        }
        SyntaxNode document = SyntaxFactory.document(paragraphs);
        logger.debug("Lexicalised document: " + document);
        return document;
    }

    SyntaxNode lexicalise(Message message, TemplateSet templates, Lexicon lexicon, List<GenerationWarning> warnings) {
        SyntaxNode clause;
        try {
            Template template = templates.getTemplate(message.getPredicate());
            if (template.getArity() != message.getArity()) {
                throw new LexicalGapException(message.getPredicate(), "Template '" + template.getName()
                        + "' takes " + template.getArity() + " argument(s), " + message + " has "
                        + message.getArity());
            }
            clause = template.instantiate();
            bind(clause, message, lexicon, warnings);
            if (message.isNegated()) {
                negate(clause);
            }
        } catch (LexicalGapException e) {
            report(e, warnings);
            clause = fallbackClause(message, lexicon, warnings);
        }
        return clause;
    }

    /**
     * Replaces every placeholder below the node by the noun phrase of the
     * corresponding message argument, and takes the words of verb and
     * adjective phrases from the lexicon where it has them.
     */
    private void bind(SyntaxNode node, Message message, Lexicon lexicon, List<GenerationWarning> warnings) {
        if (node.is(Category.VERB_PHRASE)) {
            lexicaliseHead(node, PartOfSpeech.VERB, lexicon);
        } else if (node.is(Category.ADJECTIVE_PHRASE)) {
            lexicaliseHead(node, PartOfSpeech.ADJECTIVE, lexicon);
        }
        List<SyntaxNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            SyntaxNode child = children.get(i);
            if (child.is(Category.PLACEHOLDER) && !child.isLiteralPlaceholder()) {
                Entity entity = message.getArgument(child.getPlaceholderIndex());
                children.set(i, nounPhrase(entity, lexicon, warnings));
            } else {
                bind(child, message, lexicon, warnings);
            }
        }
    }

    /**
     * Template words need no lexicon entry, so a missing one is not a gap.
     */
    private void lexicaliseHead(SyntaxNode phrase, PartOfSpeech partOfSpeech, Lexicon lexicon) {
        String head = phrase.getHead();
        if (head == null || !lexicon.contains(head)) {
            return;
        }
        LexicalEntry entry;
        try {
            entry = lexicon.getEntry(head);
        } catch (LexicalGapException e) {
            throw new IllegalStateException("lexicon lost entry " + head, e);
        }
        if (entry.getPartOfSpeech() != partOfSpeech) {
            return;
        }
        phrase.setHead(entry.getWord());
        if (!entry.getIrregularForms().isEmpty()) {
            phrase.setFeature(Feature.IRREGULAR_FORMS, entry.getIrregularForms());
        }
    }

    private void negate(SyntaxNode clause) {
        SyntaxNode predicate = clause.getPredicate();
        if (predicate == null) {
            return;
        }
        for (SyntaxNode node : SyntaxNodes.preorder(predicate)) {
            if (node.is(Category.VERB_PHRASE)) {
                node.setFeature(Feature.NEGATED, Boolean.TRUE);
            }
        }
    }

    /**
     * The default noun phrase of an entity: its lexicon word, without a
     * determiner. Referring expression generation chooses the final form.
     */
    SyntaxNode nounPhrase(Entity entity, Lexicon lexicon, List<GenerationWarning> warnings) {
        SyntaxNode np;
        try {
            LexicalEntry entry = lexicon.getEntry(entity.getLexicalKey());
            np = SyntaxFactory.nounPhrase(entry.getWord());
            if (!entry.getIrregularForms().isEmpty()) {
                np.setFeature(Feature.IRREGULAR_FORMS, entry.getIrregularForms());
            }
        } catch (LexicalGapException e) {
            report(e, warnings);
            // quantified entities have no name worth printing, their class is all we know
            String head = entity.getQuantification() == Quantification.NONE ? entity.getName()
                    : entity.getSemanticClass();
            np = SyntaxFactory.nounPhrase(head);
        }
        np.setReferent(entity);
        np.setFeature(Feature.PROPER, entity.isProper());
        np.setFeature(Feature.NUMBER, entity.getNumber());
        np.setFeature(Feature.GENDER, entity.getGender());
        np.setFeature(Feature.REFERRING_FORM, ReferringForm.FULL);
        return np;
    }

    /**
     * <code>[subject, predicate-name, objects...]</code>, with the predicate
     * name as literal text.
     */
    private SyntaxNode fallbackClause(Message message, Lexicon lexicon, List<GenerationWarning> warnings) {
        String text = message.isNegated() ? "not " + message.getPredicate() : message.getPredicate();
        if (message.getArity() == 0) {
            return SyntaxFactory.cannedClause(text);
        }
        SyntaxNode clause = SyntaxFactory.clause(nounPhrase(message.getArgument(0), lexicon, warnings),
                SyntaxFactory.literal(text));
        for (int i = 1; i < message.getArity(); i++) {
            clause.addChild(nounPhrase(message.getArgument(i), lexicon, warnings));
        }
        return clause;
    }

    private void report(LexicalGapException e, List<GenerationWarning> warnings) {
        GenerationWarning warning = GenerationWarning.lexicalGap(e);
        if (!warnings.contains(warning)) {
            logger.warn(e.getMessage());
            warnings.add(warning);
        }
    }
}
