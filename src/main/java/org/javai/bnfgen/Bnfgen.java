package org.javai.bnfgen;

import org.javai.bnfgen.gen.DerivationTree;
import org.javai.bnfgen.gen.Generator;
import org.javai.bnfgen.gen.TreeGenerator;
import org.javai.bnfgen.grammar.CheckedGrammar;
import org.javai.bnfgen.grammar.NonTerminal;
import org.javai.bnfgen.grammar.RawGrammar;
import org.javai.bnfgen.parse.BnfParser;
import org.javai.bnfgen.validate.GrammarValidator;
import org.javai.bnfgen.validate.ValidationResult;

/**
 * Entry points for the common path: grammar text to checked grammar to output.
 *
 * <pre>{@code
 * CheckedGrammar grammar = Bnfgen.compile("<S> ::= \"a\" <S> {0,3} | \"b\" ;");
 * String text = Bnfgen.generateFlat(grammar, NonTerminal.untyped("S"), 42L);
 * }</pre>
 *
 * Use {@link Generator} and {@link TreeGenerator} directly for custom settings.
 */
public final class Bnfgen {

	private static final GrammarValidator validator = new GrammarValidator();

	private Bnfgen() {}

	/**
	 * @throws org.javai.bnfgen.parse.BnfParseException on syntax errors
	 */
	public static RawGrammar parse(String source) {
		return BnfParser.parse(source);
	}

	public static ValidationResult validate(RawGrammar grammar) {
		return validator.validate(grammar);
	}

	public static ValidationResult validateWithStart(RawGrammar grammar, NonTerminal start) {
		return validator.validateWithStart(grammar, start);
	}

	/**
	 * Parse and validate in one step.
	 *
	 * @throws org.javai.bnfgen.parse.BnfParseException on syntax errors
	 * @throws org.javai.bnfgen.validate.GrammarValidationException if validation finds errors
	 */
	public static CheckedGrammar compile(String source) {
		return validate(parse(source)).requireGrammar();
	}

	/**
	 * Derive one string; a {@code null} seed draws a random one.
	 */
	public static String generateFlat(CheckedGrammar grammar, NonTerminal start, Long seed) {
		return new Generator(grammar).generate(start, seed);
	}

	public static DerivationTree generateTree(CheckedGrammar grammar, NonTerminal start, Long seed) {
		return new TreeGenerator(grammar).generate(start, seed);
	}
}
