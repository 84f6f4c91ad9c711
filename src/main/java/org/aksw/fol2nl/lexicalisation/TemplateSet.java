package org.aksw.fol2nl.lexicalisation;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.aksw.fol2nl.LexicalGapException;
import org.aksw.fol2nl.syntax.SyntaxNode;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Templates by predicate name, matched case-insensitively. Immutable once
 * built, and every lookup hands out a fresh copy of the skeleton, so a set can
 * be shared by concurrent requests.
 */
public final class TemplateSet {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_'-]*");

    private final ImmutableMap<String, Template> templates;

    private TemplateSet(Map<String, Template> templates) {
        this.templates = ImmutableMap.copyOf(templates);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws LexicalGapException if there is no template for the predicate
     */
    public Template getTemplate(String predicate) throws LexicalGapException {
        Template template = templates.get(predicate.toLowerCase(Locale.ENGLISH));
        if (template == null) {
            throw new LexicalGapException(predicate, "No template for predicate '" + predicate + "'");
        }
        return template;
    }

    public boolean contains(String predicate) {
        return templates.containsKey(predicate.toLowerCase(Locale.ENGLISH));
    }

    public int size() {
        return templates.size();
    }

    public static class Builder {

        private final Map<String, Template> templates = new LinkedHashMap<String, Template>();

        /**
         * @param name the predicate name
         * @param skeleton a CLAUSE node whose placeholders are numbered from 0
         * @throws IllegalArgumentException if the name is not an identifier or
         *             the skeleton is malformed
         */
        public Builder add(String name, SyntaxNode skeleton) {
            Preconditions.checkNotNull(skeleton);
            Preconditions.checkArgument(name != null && IDENTIFIER.matcher(name).matches(),
                    "template name '%s' is not a valid identifier", name);
            templates.put(name.toLowerCase(Locale.ENGLISH), new Template(name, skeleton));
            return this;
        }

        public TemplateSet build() {
            return new TemplateSet(templates);
        }
    }
}
