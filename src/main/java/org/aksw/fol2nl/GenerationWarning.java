package org.aksw.fol2nl;

import com.google.common.base.Preconditions;

/**
 * A recoverable problem met while generating text. The text is still
 * produced, but may contain a literal fallback or an unclear reference.
 */
public final class GenerationWarning {

    public enum Type {
        /** a template or lexicon entry was missing */
        LEXICAL_GAP,
        /** a definite description may refer to more than one entity */
        REFERENCE_AMBIGUITY
    }

    private final Type type;
    private final String key;
    private final String message;

    public GenerationWarning(Type type, String key, String message) {
        this.type = Preconditions.checkNotNull(type);
        this.key = Preconditions.checkNotNull(key);
        this.message = Preconditions.checkNotNull(message);
    }

    public static GenerationWarning lexicalGap(LexicalGapException e) {
        return new GenerationWarning(Type.LEXICAL_GAP, e.getKey(), e.getMessage());
    }

    public Type getType() {
        return type;
    }

    /**
     * @return the missing key, or the name of the ambiguously referenced entity
     */
    public String getKey() {
        return key;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof GenerationWarning)) {
            return false;
        }
        GenerationWarning other = (GenerationWarning) obj;
        return type == other.type && key.equals(other.key) && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return (type.hashCode() * 31 + key.hashCode()) * 31 + message.hashCode();
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
