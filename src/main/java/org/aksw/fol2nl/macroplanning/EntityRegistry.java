package org.aksw.fol2nl.macroplanning;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.aksw.fol2nl.LexicalGapException;
import org.aksw.fol2nl.lexicon.GrammaticalNumber;
import org.aksw.fol2nl.lexicon.LexicalEntry;
import org.aksw.fol2nl.lexicon.Lexicon;
import org.aksw.fol2nl.lexicon.gender.Gender;
import org.aksw.fol2nl.semantics.Constant;
import org.aksw.fol2nl.semantics.Entity;
import org.aksw.fol2nl.semantics.Predicate;
import org.aksw.fol2nl.semantics.Quantification;
import org.aksw.fol2nl.semantics.Quantifier;
import org.aksw.fol2nl.semantics.Variable;
import org.apache.log4j.Logger;

/**
 * Creates the entities of one planning run: one {@link Entity} per constant
 * name, and one per quantified variable binding. Not thread-safe; a new
 * registry is used for every call to {@link Macroplanner#plan}.
 */
class EntityRegistry {

	private static final Logger logger = Logger.getLogger(EntityRegistry.class.getName());

	private final Lexicon lexicon;
	private final Map<String, Entity> constants = new LinkedHashMap<String, Entity>();

	EntityRegistry(Lexicon lexicon) {
		this.lexicon = lexicon;
	}

	/**
	 * @return the entity named by the constant, created on first use
	 */
	Entity forConstant(Constant constant) {
		String name = constant.getName();
		Entity entity = constants.get(name);
		if (entity == null) {
			LexicalEntry entry = lookup(name);
			if (entry == null) {
				// no entry: treat the constant as a name and let the lexicaliser report the gap
				entity = new Entity(name, name, Gender.UNKNOWN, GrammaticalNumber.SINGULAR, name, true,
						Quantification.NONE);
			} else {
				entity = new Entity(name, entry.getKey(), entry.getGender(), entry.getNumber(),
						entry.getSemanticClass(), entry.isProperNoun(), Quantification.NONE);
			}
			logger.debug("New entity " + entity);
			constants.put(name, entity);
		}
		return entity;
	}

	/**
	 * Creates the entity introduced by a quantified variable. Its class, gender
	 * and number come from the grounding predicate's lexicon entry.
	 */
	Entity forVariable(Variable variable, Quantifier quantifier, Predicate grounding) {
		String className = grounding.getName();
		LexicalEntry entry = lookup(className);
		Entity entity;
		if (entry == null) {
			entity = new Entity(variable.getName(), className, Gender.UNKNOWN, GrammaticalNumber.SINGULAR,
					className.toLowerCase(Locale.ENGLISH), false, Quantification.of(quantifier));
		} else {
			entity = new Entity(variable.getName(), entry.getKey(), entry.getGender(), entry.getNumber(),
					entry.getSemanticClass(), false, Quantification.of(quantifier));
		}
		logger.debug("New entity " + entity + " for " + quantifier.getKeyword() + " " + variable);
		return entity;
	}

	private LexicalEntry lookup(String key) {
		if (lexicon == null) {
			return null;
		}
		try {
			return lexicon.getEntry(key);
		} catch (LexicalGapException e) {
			logger.debug("Using defaults for " + key + ": " + e.getMessage());
			return null;
		}
	}
}
