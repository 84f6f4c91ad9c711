/**
 *
 */
package org.aksw.fol2nl.semantics;

import java.text.ParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Parses the textual FOL input format into {@link Formula} objects.
 *
 * <pre>
 * input      := statement (';' statement)*
 * formula    := quantified | unary (('&amp;' | 'and') unary)*
 * quantified := ('forall' | 'exists') var (',' var)* ':' formula
 * unary      := ('~' | 'not') unary | '(' formula ')' | quantified | atom
 * atom       := Name ['(' term (',' term)* ')']
 * term       := name | '?'name
 * </pre>
 *
 * A quantifier's scope extends as far right as possible. A term is a
 * {@link Variable} if it is bound by an enclosing quantifier or written with a
 * leading <code>?</code>, otherwise a {@link Constant}. Text after
 * <code>#</code> up to the end of the line is ignored.
 */
public class FormulaParser {

	private static final Logger logger = Logger.getLogger(FormulaParser.class.getName());

	private String input;
	private int pos;
	private Deque<String> boundVariables;

	/**
	 * Parses a sequence of statements separated by <code>;</code>. Empty
	 * statements are skipped.
	 *
	 * @param input the textual input
	 * @return the formulas in input order
	 * @throws ParseException if the input is not well-formed; the error offset
	 *             points at the offending character
	 */
	public List<Formula> parse(String input) throws ParseException {
		reset(input);
		List<Formula> formulas = new ArrayList<Formula>();
		skipWhitespace();
		while (pos < input.length()) {
			if (peek() == ';') {
				pos++;
			} else {
				formulas.add(parseFormula());
				skipWhitespace();
				if (pos < input.length()) {
					expect(';');
				}
			}
			skipWhitespace();
		}
		logger.debug("Parsed " + formulas.size() + " formula(s) from input");
		return formulas;
	}

	/**
	 * Parses exactly one formula.
	 */
	public Formula parseSingle(String input) throws ParseException {
		reset(input);
		Formula formula = parseFormula();
		skipWhitespace();
		if (pos < input.length()) {
			throw error("Unexpected input '" + input.substring(pos) + "'");
		}
		return formula;
	}

	private void reset(String input) {
		this.input = input;
		this.pos = 0;
		this.boundVariables = new ArrayDeque<String>();
	}

	private Formula parseFormula() throws ParseException {
		skipWhitespace();
		if (lookingAtKeyword("forall") || lookingAtKeyword("exists")) {
			return parseQuantified();
		}
		List<Formula> conjuncts = new ArrayList<Formula>();
		conjuncts.add(parseUnary());
		while (true) {
			skipWhitespace();
			if (pos < input.length() && peek() == '&') {
				pos++;
			} else if (lookingAtKeyword("and")) {
				pos += "and".length();
			} else {
				break;
			}
			conjuncts.add(parseUnary());
		}
		return conjuncts.size() == 1 ? conjuncts.get(0) : new Conjunction(conjuncts);
	}

	private Formula parseQuantified() throws ParseException {
		Quantifier quantifier = lookingAtKeyword("forall") ? Quantifier.FORALL : Quantifier.EXISTS;
		pos += quantifier.getKeyword().length();
		List<Variable> variables = new ArrayList<Variable>();
		do {
			skipWhitespace();
			if (pos < input.length() && peek() == '?') {
				pos++;
			}
			variables.add(new Variable(parseName()));
			skipWhitespace();
		} while (consume(','));
		expect(':');

		for (Variable variable : variables) {
			boundVariables.push(variable.getName());
		}
		Formula body = parseFormula();
		for (int i = 0; i < variables.size(); i++) {
			boundVariables.pop();
		}

		// forall x, y: f is forall x: forall y: f
		for (int i = variables.size() - 1; i >= 0; i--) {
			body = new Quantified(quantifier, variables.get(i), body);
		}
		return body;
	}

	private Formula parseUnary() throws ParseException {
		skipWhitespace();
		if (pos >= input.length()) {
			throw error("Unexpected end of input");
		}
		if (peek() == '~') {
			pos++;
			return new Negation(parseUnary());
		}
		if (lookingAtKeyword("not")) {
			pos += "not".length();
			return new Negation(parseUnary());
		}
		if (peek() == '(') {
			pos++;
			Formula inner = parseFormula();
			skipWhitespace();
			expect(')');
			return inner;
		}
		if (lookingAtKeyword("forall") || lookingAtKeyword("exists")) {
			return parseQuantified();
		}
		return parseAtom();
	}

	private Formula parseAtom() throws ParseException {
		String name = parseName();
		skipWhitespace();
		List<Term> args = new ArrayList<Term>();
		if (consume('(')) {
			do {
				args.add(parseTerm());
				skipWhitespace();
			} while (consume(','));
			expect(')');
		}
		return new Predicate(name, args);
	}

	private Term parseTerm() throws ParseException {
		skipWhitespace();
		if (consume('?')) {
			return new Variable(parseName());
		}
		String name = parseName();
		if (boundVariables.contains(name)) {
			return new Variable(name);
		}
		return new Constant(name);
	}

	private String parseName() throws ParseException {
		skipWhitespace();
		int start = pos;
		if (pos >= input.length() || !(Character.isLetter(peek()) || peek() == '_')) {
			throw error("Expected a name");
		}
		while (pos < input.length() && isNameChar(peek())) {
			pos++;
		}
		return input.substring(start, pos);
	}

	private boolean isNameChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '\'';
	}

	private boolean lookingAtKeyword(String keyword) {
		if (!input.startsWith(keyword, pos)) {
			return false;
		}
		int end = pos + keyword.length();
		return end >= input.length() || !isNameChar(input.charAt(end));
	}

	private boolean consume(char c) {
		skipWhitespace();
		if (pos < input.length() && peek() == c) {
			pos++;
			return true;
		}
		return false;
	}

	private void expect(char c) throws ParseException {
		if (!consume(c)) {
			throw error("Expected '" + c + "'");
		}
	}

	private char peek() {
		return input.charAt(pos);
	}

	private void skipWhitespace() {
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (c == '#') {
				while (pos < input.length() && input.charAt(pos) != '\n') {
					pos++;
				}
			} else if (Character.isWhitespace(c)) {
				pos++;
			} else {
				return;
			}
		}
	}

	private ParseException error(String message) {
		return new ParseException(message + " at position " + pos + " in: " + input, pos);
	}
}
