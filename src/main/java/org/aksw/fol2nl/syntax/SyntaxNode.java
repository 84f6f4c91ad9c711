package org.aksw.fol2nl.syntax;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.aksw.fol2nl.semantics.Entity;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

/**
 * A node of a syntactic tree, tagged with its {@link Category}.
 *
 * <p>Every node has ordered children and a feature mapping. Phrases carry a
 * lexical head word, noun phrases may be bound to the {@link Entity} they
 * mention, and placeholders carry either the index of the message argument
 * they stand for or a literal string.</p>
 *
 * <p>Conventions by category:</p>
 * <ul>
 * <li>DOCUMENT: paragraphs; PARAGRAPH: clauses</li>
 * <li>CLAUSE: <code>[subject, predicate]</code>, where the predicate is a verb
 * phrase, a coordination of verb phrases or a literal placeholder (a clause
 * holding only a literal placeholder is a canned sentence)</li>
 * <li>VERB_PHRASE: head is the verb, children are complements</li>
 * <li>NOUN_PHRASE, ADJECTIVE_PHRASE: head word, children are modifiers</li>
 * <li>COORDINATED_PHRASE: coordinates, joined by the CONJUNCTION feature</li>
 * </ul>
 *
 * <p>Nodes are owned by a single tree and are mutated in place by referring
 * expression generation and aggregation. Equality is structural, except that
 * referents are compared by identity.</p>
 */
public final class SyntaxNode {

    public static final int NO_INDEX = -1;

    private final Category category;
    private String head;
    private Entity referent;
    private int placeholderIndex = NO_INDEX;
    private final List<SyntaxNode> children = new ArrayList<SyntaxNode>();
    private final Map<Feature, Object> features = new EnumMap<Feature, Object>(Feature.class);

    public SyntaxNode(Category category) {
        this.category = Preconditions.checkNotNull(category);
    }

    public SyntaxNode(Category category, String head) {
        this(category);
        this.head = head;
    }

    public Category getCategory() {
        return category;
    }

    public boolean is(Category category) {
        return this.category == category;
    }

    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        switch (category) {
        case DOCUMENT:
            return visitor.visitDocument(this);
        case PARAGRAPH:
            return visitor.visitParagraph(this);
        case CLAUSE:
            return visitor.visitClause(this);
        case NOUN_PHRASE:
            return visitor.visitNounPhrase(this);
        case VERB_PHRASE:
            return visitor.visitVerbPhrase(this);
        case ADJECTIVE_PHRASE:
            return visitor.visitAdjectivePhrase(this);
        case COORDINATED_PHRASE:
            return visitor.visitCoordinatedPhrase(this);
        case PLACEHOLDER:
            return visitor.visitPlaceholder(this);
        default:
            throw new IllegalStateException("Unknown category " + category);
        }
    }

    public String getHead() {
        return head;
    }

    public void setHead(String head) {
        this.head = head;
    }

    public Entity getReferent() {
        return referent;
    }

    public void setReferent(Entity referent) {
        this.referent = referent;
    }

    public boolean hasReferent() {
        return referent != null;
    }

    /**
     * @return the argument index of a placeholder, or {@link #NO_INDEX} for
     *         literal placeholders and all other nodes
     */
    public int getPlaceholderIndex() {
        return placeholderIndex;
    }

    public void setPlaceholderIndex(int placeholderIndex) {
        this.placeholderIndex = placeholderIndex;
    }

    public boolean isLiteralPlaceholder() {
        return category == Category.PLACEHOLDER && placeholderIndex == NO_INDEX;
    }

    /**
     * @return the live list of children; changes write through to the tree
     */
    public List<SyntaxNode> getChildren() {
        return children;
    }

    public SyntaxNode getChild(int index) {
        return children.get(index);
    }

    public SyntaxNode addChild(SyntaxNode child) {
        children.add(Preconditions.checkNotNull(child));
        return this;
    }

    public void setChildren(List<SyntaxNode> newChildren) {
        List<SyntaxNode> copy = new ArrayList<SyntaxNode>(newChildren);
        children.clear();
        children.addAll(copy);
    }

    public SyntaxNode getSubject() {
        checkClause();
        return children.get(0);
    }

    public SyntaxNode getPredicate() {
        checkClause();
        return children.size() > 1 ? children.get(1) : null;
    }

    private void checkClause() {
        Preconditions.checkState(category == Category.CLAUSE && !children.isEmpty(), "not a clause: %s", this);
    }

    public Object getFeature(Feature feature) {
        return features.get(feature);
    }

    public <T> T getFeature(Feature feature, Class<T> type) {
        return type.cast(features.get(feature));
    }

    public boolean hasFeature(Feature feature) {
        return features.containsKey(feature);
    }

    /**
     * @return true if the boolean feature is set to true
     */
    public boolean isFeature(Feature feature) {
        return Boolean.TRUE.equals(features.get(feature));
    }

    public SyntaxNode setFeature(Feature feature, Object value) {
        if (value == null) {
            features.remove(feature);
        } else {
            Preconditions.checkArgument(feature.getValueType().isInstance(value),
                    "feature %s expects a %s, got %s", feature, feature.getValueType().getSimpleName(), value);
            features.put(feature, value);
        }
        return this;
    }

    public void removeFeature(Feature feature) {
        features.remove(feature);
    }

    public Map<Feature, Object> getFeatures() {
        return features;
    }

    /**
     * Deep copy of this subtree. Referents are shared, not copied.
     */
    public SyntaxNode copy() {
        SyntaxNode copy = new SyntaxNode(category, head);
        copy.referent = referent;
        copy.placeholderIndex = placeholderIndex;
        copy.features.putAll(features);
        for (SyntaxNode child : children) {
            copy.children.add(child.copy());
        }
        return copy;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SyntaxNode)) {
            return false;
        }
        SyntaxNode other = (SyntaxNode) obj;
        return category == other.category
                && (head == null ? other.head == null : head.equals(other.head))
                && referent == other.referent
                && placeholderIndex == other.placeholderIndex
                && features.equals(other.features)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        int hash = category.hashCode();
        hash = 31 * hash + (head == null ? 0 : head.hashCode());
        hash = 31 * hash + System.identityHashCode(referent);
        hash = 31 * hash + placeholderIndex;
        hash = 31 * hash + features.hashCode();
        return 31 * hash + children.hashCode();
    }

    /**
     * Bracketed representation, e.g.
     * <code>(CLAUSE (NOUN_PHRASE John) (VERB_PHRASE play (NOUN_PHRASE the guitar)))</code>.
     */
    @Override
    public String toString() {
        List<String> parts = new ArrayList<String>();
        parts.add(category.name());
        if (category == Category.PLACEHOLDER && placeholderIndex != NO_INDEX) {
            parts.add("#" + placeholderIndex);
        }
        if (hasFeature(Feature.DETERMINER)) {
            parts.add(getFeature(Feature.DETERMINER, String.class));
        }
        if (head != null) {
            parts.add(head);
        }
        for (SyntaxNode child : children) {
            parts.add(child.toString());
        }
        return "(" + Joiner.on(' ').join(parts) + ")";
    }
}
