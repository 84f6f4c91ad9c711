package org.aksw.fol2nl.aggregation;

import java.util.ArrayList;
import java.util.List;

import org.aksw.fol2nl.aggregation.rules.PredicateMergeRule;
import org.aksw.fol2nl.aggregation.rules.Rule;
import org.aksw.fol2nl.aggregation.rules.SubjectMergeRule;
import org.aksw.fol2nl.syntax.Category;
import org.aksw.fol2nl.syntax.SyntaxNode;
import org.aksw.fol2nl.syntax.SyntaxNodes;
import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

/**
 * Removes redundancy between adjacent clauses of a paragraph by merging them
 * with the configured {@link Rule rules}.
 *
 * <p>Each paragraph is scanned once from left to right. The first rule that
 * applies to a pair of adjacent clauses replaces both by the merged clause,
 * and the scan continues after the pair, so a merged clause is never merged
 * again. Paragraphs without mergeable clauses are left untouched.</p>
 */
public class Aggregator {

    private static final Logger logger = Logger.getLogger(Aggregator.class.getName());

    private List<Rule> rules = ImmutableList.<Rule>of(new SubjectMergeRule(), new PredicateMergeRule());
    private boolean enabled = true;

    /**
     * Sets the rules in the order they are tried. Defaults to
     * {@link SubjectMergeRule} followed by {@link PredicateMergeRule}.
     */
    public void setRules(List<? extends Rule> rules) {
        this.rules = ImmutableList.copyOf(rules);
    }

    public List<Rule> getRules() {
        return rules;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Aggregates every paragraph of the tree in place.
     *
     * @return the given root
     */
    public SyntaxNode aggregate(SyntaxNode root) {
        if (!enabled) {
            return root;
        }
        int merges = 0;
        for (SyntaxNode node : SyntaxNodes.preorder(root)) {
            if (node.is(Category.PARAGRAPH)) {
                merges += aggregateParagraph(node);
            }
        }
        logger.info("Aggregation merged " + merges + " pair(s) of clauses");
        return root;
    }

    private int aggregateParagraph(SyntaxNode paragraph) {
        List<SyntaxNode> clauses = paragraph.getChildren();
        List<SyntaxNode> result = new ArrayList<SyntaxNode>();
        int merges = 0;
        int i = 0;
        while (i < clauses.size()) {
            SyntaxNode merged = null;
            if (i + 1 < clauses.size()) {
                merged = merge(clauses.get(i), clauses.get(i + 1));
            }
            if (merged != null) {
                result.add(merged);
                merges++;
                i += 2;
            } else {
                result.add(clauses.get(i));
                i++;
            }
        }
        if (merges > 0) {
            paragraph.setChildren(result);
        }
        return merges;
    }

    private SyntaxNode merge(SyntaxNode first, SyntaxNode second) {
        for (Rule rule : rules) {
            if (rule.isApplicable(first, second)) {
                SyntaxNode merged = rule.apply(first, second);
                logger.debug(rule.getClass().getSimpleName() + " merged " + first + " and " + second);
                return merged;
            }
        }
        return null;
    }
}
