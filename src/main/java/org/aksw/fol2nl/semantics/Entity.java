/**
 *
 */
package org.aksw.fol2nl.semantics;

import org.aksw.fol2nl.lexicon.GrammaticalNumber;
import org.aksw.fol2nl.lexicon.gender.Gender;

import com.google.common.base.Preconditions;

/**
 * A discourse referent. Entities are shared by reference between all messages
 * that mention them; two mentions corefer iff they hold the same instance, so
 * equality is identity.
 */
public final class Entity {

	private final String name;
	private final String lexicalKey;
	private final Gender gender;
	private final GrammaticalNumber number;
	private final String semanticClass;
	private final boolean proper;
	private final Quantification quantification;

	/**
	 * @param name the canonical name, i.e. the constant or variable name
	 * @param lexicalKey the lexicon key the default noun phrase is drawn from
	 * @param gender the grammatical gender
	 * @param number the grammatical number
	 * @param semanticClass the common noun used for definite reference
	 * @param proper whether the entity is named by a proper noun
	 * @param quantification how the entity was introduced
	 */
	public Entity(String name, String lexicalKey, Gender gender, GrammaticalNumber number, String semanticClass,
			boolean proper, Quantification quantification) {
		this.name = Preconditions.checkNotNull(name);
		this.lexicalKey = Preconditions.checkNotNull(lexicalKey);
		this.gender = Preconditions.checkNotNull(gender);
		this.number = Preconditions.checkNotNull(number);
		this.semanticClass = Preconditions.checkNotNull(semanticClass);
		this.proper = proper;
		this.quantification = Preconditions.checkNotNull(quantification);
	}

	public String getName() {
		return name;
	}

	public String getLexicalKey() {
		return lexicalKey;
	}

	public Gender getGender() {
		return gender;
	}

	public GrammaticalNumber getNumber() {
		return number;
	}

	public String getSemanticClass() {
		return semanticClass;
	}

	public boolean isProper() {
		return proper;
	}

	public Quantification getQuantification() {
		return quantification;
	}

	/**
	 * @return true if this entity and the other one would be referred to by
	 *         the same pronoun
	 */
	public boolean agreesWith(Entity other) {
		return gender == other.gender && number == other.number;
	}

	@Override
	public String toString() {
		return name + "[" + semanticClass + ", " + gender + ", " + number + "]";
	}
}
