package org.javai.bnfgen.parse;

import java.util.ArrayList;
import java.util.List;
import org.javai.bnfgen.grammar.Alternative;
import org.javai.bnfgen.grammar.InvokeLimit;
import org.javai.bnfgen.grammar.NonTerminal;
import org.javai.bnfgen.grammar.RawGrammar;
import org.javai.bnfgen.grammar.Rule;
import org.javai.bnfgen.grammar.Span;
import org.javai.bnfgen.grammar.Symbol;
import org.javai.bnfgen.grammar.WeightedProduction;

/**
 * Recursive-descent parser for the grammar DSL.
 *
 * <pre>
 * Rule    ::= "&lt;" id [":" string] "&gt;" "::=" Alt ("|" Alt)* ";"
 * Alt     ::= [int] Symbol+ ["{" int ["," [int]] "}"]
 * Symbol  ::= string | "&lt;" id [":" string] "&gt;" | "re" "(" string ")"
 * </pre>
 *
 * Example usage:
 *
 * <pre>
 * RawGrammar grammar = BnfParser.parse("&lt;S&gt; ::= \"a\" &lt;S&gt; {0,3} | \"b\" ;");
 * </pre>
 *
 * The parser only checks syntax; undefined references, duplicates and malformed
 * limit ranges are left for the validator.
 */
public class BnfParser {

	private static final String REGEX_KEYWORD = "re";

	private final List<BnfToken> tokens;
	private int current = 0;

	public BnfParser(List<BnfToken> tokens) {
		if (tokens == null || tokens.isEmpty() || !tokens.get(tokens.size() - 1).isType(BnfToken.TokenType.EOF)) {
			throw new IllegalArgumentException("Token list must end with an EOF token");
		}
		this.tokens = tokens;
	}

	/**
	 * Tokenizes and parses grammar source text.
	 *
	 * @throws BnfParseException on any lexical or syntax error
	 */
	public static RawGrammar parse(String source) {
		return new BnfParser(new BnfTokenizer(source).tokenize()).parse();
	}

	/**
	 * Parses the tokens into rules, in source order.
	 *
	 * @throws BnfParseException on any syntax error
	 */
	public RawGrammar parse() {
		List<Rule> rules = new ArrayList<>();
		while (!check(BnfToken.TokenType.EOF)) {
			rules.add(parseRule());
		}
		return new RawGrammar(rules);
	}

	private Rule parseRule() {
		BnfToken first = peek();
		NonTerminal lhs = parseNonTerminal();
		expect(BnfToken.TokenType.DEFINE, "'::=' after rule name " + lhs);

		List<Alternative> alternatives = new ArrayList<>();
		alternatives.add(parseAlternative(lhs));
		while (match(BnfToken.TokenType.PIPE)) {
			alternatives.add(parseAlternative(lhs));
		}
		BnfToken semicolon = expect(BnfToken.TokenType.SEMICOLON, "';' or '|' after alternative of " + lhs);
		return new Rule(lhs, new WeightedProduction(alternatives), Span.of(first.start(), semicolon.end()));
	}

	private Alternative parseAlternative(NonTerminal lhs) {
		BnfToken first = peek();
		int weight = Alternative.DEFAULT_WEIGHT;
		if (check(BnfToken.TokenType.INTEGER)) {
			BnfToken weightToken = advance();
			weight = toInt(weightToken);
			if (weight < 1) {
				throw new BnfParseException("Weight must be at least 1, was " + weight, weightToken.start());
			}
		}

		List<Symbol> symbols = new ArrayList<>();
		while (startsSymbol()) {
			symbols.add(parseSymbol());
		}
		if (symbols.isEmpty()) {
			throw new BnfParseException("Expected a symbol in alternative of " + lhs + ", found " + peek(), peek().start());
		}

		InvokeLimit limit = InvokeLimit.unlimited();
		if (check(BnfToken.TokenType.LBRACE)) {
			limit = parseLimit();
		}
		BnfToken last = tokens.get(current - 1);
		return new Alternative(symbols, weight, limit, Span.of(first.start(), last.end()));
	}

	private boolean startsSymbol() {
		BnfToken token = peek();
		return token.isType(BnfToken.TokenType.STRING)
				|| token.isType(BnfToken.TokenType.LANGLE)
				|| (token.isIdentifier(REGEX_KEYWORD) && peekNext().isType(BnfToken.TokenType.LPAREN));
	}

	private Symbol parseSymbol() {
		BnfToken token = peek();
		if (token.isType(BnfToken.TokenType.STRING)) {
			advance();
			return new Symbol.Terminal(token.value(), token.span());
		}
		if (token.isType(BnfToken.TokenType.LANGLE)) {
			NonTerminal target = parseNonTerminal();
			return new Symbol.NonTerminalRef(target, Span.of(token.start(), tokens.get(current - 1).end()));
		}
		advance(); // re
		expect(BnfToken.TokenType.LPAREN, "'(' after re");
		BnfToken pattern = expect(BnfToken.TokenType.STRING, "pattern string in re(...)");
		BnfToken close = expect(BnfToken.TokenType.RPAREN, "')' to close re(...)");
		return new Symbol.Regex(pattern.value(), Span.of(token.start(), close.end()));
	}

	private NonTerminal parseNonTerminal() {
		expect(BnfToken.TokenType.LANGLE, "'<'");
		BnfToken name = peek();
		if (!name.isType(BnfToken.TokenType.IDENTIFIER) && !name.isType(BnfToken.TokenType.INTEGER)) {
			throw new BnfParseException("Expected non-terminal name, found " + name, name.start());
		}
		advance();
		String typeTag = null;
		if (match(BnfToken.TokenType.COLON)) {
			typeTag = expect(BnfToken.TokenType.STRING, "type string after ':'").value();
		}
		expect(BnfToken.TokenType.RANGLE, "'>' after non-terminal name");
		return new NonTerminal(name.value(), typeTag);
	}

	/**
	 * {@code {n}}, {@code {min,max}} or {@code {min,}}.
	 */
	private InvokeLimit parseLimit() {
		advance(); // {
		int min = toInt(expect(BnfToken.TokenType.INTEGER, "integer in invoke limit"));
		InvokeLimit.Limited limit;
		if (match(BnfToken.TokenType.COMMA)) {
			if (check(BnfToken.TokenType.INTEGER)) {
				limit = InvokeLimit.between(min, toInt(advance()));
			} else {
				limit = InvokeLimit.atLeast(min);
			}
		} else {
			limit = InvokeLimit.exactly(min);
		}
		expect(BnfToken.TokenType.RBRACE, "'}' to close invoke limit");
		return limit;
	}

	private int toInt(BnfToken token) {
		try {
			return Integer.parseInt(token.value());
		}
		catch (NumberFormatException ex) {
			throw new BnfParseException("Integer out of range: " + token.value(), token.start(), ex);
		}
	}

	private BnfToken expect(BnfToken.TokenType type, String what) {
		BnfToken token = peek();
		if (!token.isType(type)) {
			throw new BnfParseException("Expected " + what + ", found " + token, token.start());
		}
		return advance();
	}

	private boolean match(BnfToken.TokenType type) {
		if (check(type)) {
			advance();
			return true;
		}
		return false;
	}

	private boolean check(BnfToken.TokenType type) {
		return peek().isType(type);
	}

	private BnfToken peek() {
		return tokens.get(current);
	}

	private BnfToken peekNext() {
		return tokens.get(Math.min(current + 1, tokens.size() - 1));
	}

	private BnfToken advance() {
		BnfToken token = tokens.get(current);
		if (!token.isType(BnfToken.TokenType.EOF)) {
			current++;
		}
		return token;
	}
}
