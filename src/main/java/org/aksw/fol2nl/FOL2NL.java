package org.aksw.fol2nl;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;

import org.aksw.fol2nl.aggregation.Aggregator;
import org.aksw.fol2nl.lexicalisation.Lexicaliser;
import org.aksw.fol2nl.lexicalisation.TemplateSet;
import org.aksw.fol2nl.lexicon.Lexicon;
import org.aksw.fol2nl.macroplanning.DocumentPlan;
import org.aksw.fol2nl.macroplanning.Macroplanner;
import org.aksw.fol2nl.realisation.Realiser;
import org.aksw.fol2nl.reg.DiscourseState;
import org.aksw.fol2nl.reg.ReferringExpressionGenerator;
import org.aksw.fol2nl.semantics.Formula;
import org.aksw.fol2nl.semantics.FormulaParser;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

/**
 * Verbalizes first-order logic formulas. The pipeline runs content planning,
 * lexicalisation, referring expression generation and aggregation, and hands
 * the resulting tree to a {@link Realiser}.
 *
 * <pre>
 * FOL2NL fol2nl = new FOL2NL();
 * String text = fol2nl.realise("Play(john, guitar) &amp; Play(paul, guitar)", templates, lexicon,
 *         new SimpleNLGRealiser());
 * </pre>
 *
 * <p>The stages hold configuration only. All state of a request is created
 * per call, so one instance may serve concurrent requests once configured.</p>
 */
public class FOL2NL {

    private static final Logger logger = Logger.getLogger(FOL2NL.class.getName());

    private boolean groupRelatedMessages = true;
    private final Lexicaliser lexicaliser = new Lexicaliser();
    private final ReferringExpressionGenerator referringExpressionGenerator = new ReferringExpressionGenerator();
    private final Aggregator aggregator = new Aggregator();

    /**
     * Runs the pipeline up to the finished syntax tree.
     *
     * @param formulas the input formulas, in presentation order
     * @param templates a template per predicate
     * @param lexicon words for entities, classes, verbs and adjectives
     * @return the tree and the warnings of the request
     * @throws ContentException if a formula cannot be planned; no tree is
     *             produced then
     */
    public GenerationResult realiseText(List<Formula> formulas, TemplateSet templates, Lexicon lexicon) {
        Preconditions.checkNotNull(templates, "templates must not be null");
        Preconditions.checkNotNull(lexicon, "lexicon must not be null");
        logger.info("Verbalizing " + formulas.size() + " formula(s)...");
        List<GenerationWarning> warnings = new ArrayList<GenerationWarning>();

        Macroplanner macroplanner = new Macroplanner(lexicon);
        macroplanner.setGroupRelatedMessages(groupRelatedMessages);
        DocumentPlan plan = macroplanner.plan(formulas);

        SyntaxNode tree = lexicaliser.lexicalise(plan, templates, lexicon, warnings);

        DiscourseState state = referringExpressionGenerator.generateReferences(tree, new DiscourseState());
        warnings.addAll(state.getWarnings());

        aggregator.aggregate(tree);

        logger.info("...done with " + warnings.size() + " warning(s).");
        return new GenerationResult(tree, warnings);
    }

    /**
     * Parses the input with {@link FormulaParser} and runs
     * {@link #realiseText(List, TemplateSet, Lexicon)}.
     */
    public GenerationResult realiseText(String input, TemplateSet templates, Lexicon lexicon)
            throws ParseException {
        return realiseText(new FormulaParser().parse(input), templates, lexicon);
    }

    /**
     * Runs the whole pipeline including surface realisation.
     *
     * @throws ContentException if a formula cannot be planned
     * @throws RealisationException if the realiser fails
     */
    public String realise(List<Formula> formulas, TemplateSet templates, Lexicon lexicon, Realiser realiser) {
        GenerationResult result = realiseText(formulas, templates, lexicon);
        for (GenerationWarning warning : result.getWarnings()) {
            logger.debug(warning);
        }
        return realiser.realise(result.getTree());
    }

    public String realise(String input, TemplateSet templates, Lexicon lexicon, Realiser realiser)
            throws ParseException {
        return realise(new FormulaParser().parse(input), templates, lexicon, realiser);
    }

    /**
     * @see Macroplanner#setGroupRelatedMessages(boolean)
     */
    public void setGroupRelatedMessages(boolean groupRelatedMessages) {
        this.groupRelatedMessages = groupRelatedMessages;
    }

    public Lexicaliser getLexicaliser() {
        return lexicaliser;
    }

    public ReferringExpressionGenerator getReferringExpressionGenerator() {
        return referringExpressionGenerator;
    }

    public Aggregator getAggregator() {
        return aggregator;
    }
}
