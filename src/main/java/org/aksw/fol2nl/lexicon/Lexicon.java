package org.aksw.fol2nl.lexicon;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.aksw.fol2nl.LexicalGapException;
import org.aksw.fol2nl.lexicon.gender.Gender;
import org.aksw.fol2nl.lexicon.gender.GenderDetector;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Maps entity keys and predicate names to {@link LexicalEntry lexical
 * entries}. Keys are validated identifiers and are matched case-insensitively.
 *
 * <p>A lexicon is immutable once built and can be shared between concurrent
 * verbalizations.</p>
 */
public final class Lexicon {

    private static final Logger logger = Logger.getLogger(Lexicon.class.getName());

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_'-]*");

    private final ImmutableMap<String, LexicalEntry> entries;

    private Lexicon(Map<String, LexicalEntry> entries) {
        this.entries = ImmutableMap.copyOf(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the entry for the given key.
     *
     * @param key an entity key or predicate name
     * @return the entry
     * @throws LexicalGapException if the lexicon has no entry for the key
     */
    public LexicalEntry getEntry(String key) throws LexicalGapException {
        LexicalEntry entry = entries.get(normalize(key));
        if (entry == null) {
            throw new LexicalGapException(key, "No lexicon entry for '" + key + "'");
        }
        return entry;
    }

    public boolean contains(String key) {
        return entries.containsKey(normalize(key));
    }

    public Collection<LexicalEntry> getEntries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    private static String normalize(String key) {
        return key.toLowerCase(Locale.ENGLISH);
    }

    public static class Builder {

        private final Map<String, LexicalEntry> entries = new LinkedHashMap<String, LexicalEntry>();
        private GenderDetector genderDetector;

        /**
         * Adds an entry, replacing any earlier entry with the same key.
         *
         * @throws IllegalArgumentException if the key is not an identifier
         */
        public Builder add(LexicalEntry entry) {
            Preconditions.checkNotNull(entry);
            Preconditions.checkArgument(IDENTIFIER.matcher(entry.getKey()).matches(),
                    "lexicon key '%s' is not a valid identifier", entry.getKey());
            entries.put(normalize(entry.getKey()), entry);
            return this;
        }

        public Builder addAll(Iterable<LexicalEntry> entries) {
            for (LexicalEntry entry : entries) {
                add(entry);
            }
            return this;
        }

        /**
         * Sets a detector used to fill in the gender of proper nouns that were
         * added with {@link Gender#UNKNOWN}.
         */
        public Builder setGenderDetector(GenderDetector genderDetector) {
            this.genderDetector = genderDetector;
            return this;
        }

        public Lexicon build() {
            Map<String, LexicalEntry> result = new LinkedHashMap<String, LexicalEntry>(entries);
            if (genderDetector != null) {
                for (Map.Entry<String, LexicalEntry> e : entries.entrySet()) {
                    LexicalEntry entry = e.getValue();
                    if (entry.isProperNoun() && entry.getGender() == Gender.UNKNOWN) {
                        //we take the first token because we assume this is the first name
                        String firstToken = entry.getWord().split(" ")[0];
                        Gender gender = genderDetector.getGender(firstToken);
                        if (gender != Gender.UNKNOWN) {
                            logger.debug("Detected gender " + gender + " for " + entry.getWord());
                            result.put(e.getKey(), entry.withGender(gender));
                        }
                    }
                }
            }
            logger.debug("Built lexicon with " + result.size() + " entries");
            return new Lexicon(result);
        }
    }
}
