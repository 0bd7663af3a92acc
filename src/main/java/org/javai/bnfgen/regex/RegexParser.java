package org.javai.bnfgen.regex;

import java.util.ArrayList;
import java.util.List;
import org.javai.bnfgen.regex.RegexNode.CharClass;
import org.javai.bnfgen.regex.RegexNode.CharRange;

/**
 * Recursive-descent parser from pattern text to {@link RegexNode}.
 * <p>
 * Grammar:
 * <pre>
 * alternation := concat ('|' concat)*
 * concat      := quantified*
 * quantified  := atom (('*' | '+' | '?' | '{' n [',' [m]] '}') ['?' | '+'])?
 * atom        := literal | '.' | class | '(' ['?:'] alternation ')' | escape | anchor
 * </pre>
 * Negated classes and {@code .} draw from printable ASCII only. Inside a class
 * {@code \b} is a backspace. Repetition counts may not exceed {@link #MAX_REPEAT}.
 */
public final class RegexParser {

	/**
	 * Largest count accepted in a {@code {n}}, {@code {n,}} or {@code {n,m}} quantifier.
	 */
	public static final int MAX_REPEAT = 1000;

	private final String pattern;
	private int pos;

	private RegexParser(String pattern) {
		this.pattern = pattern;
	}

	/**
	 * Parse a pattern.
	 *
	 * @throws RegexCompileException if the pattern is malformed or uses unsupported syntax
	 */
	public static RegexNode parse(String pattern) {
		if (pattern == null) {
			throw new IllegalArgumentException("Pattern cannot be null");
		}
		RegexParser parser = new RegexParser(pattern);
		RegexNode node = parser.parseAlternation();
		if (!parser.isAtEnd()) {
			// only an unmatched ')' stops the top-level alternation early
			throw parser.error("Unmatched ')'");
		}
		return node;
	}

	private RegexNode parseAlternation() {
		List<RegexNode> branches = new ArrayList<>();
		branches.add(parseConcat());
		while (!isAtEnd() && peek() == '|') {
			advance();
			branches.add(parseConcat());
		}
		return branches.size() == 1 ? branches.get(0) : new RegexNode.Alternation(branches);
	}

	private RegexNode parseConcat() {
		List<RegexNode> parts = new ArrayList<>();
		while (!isAtEnd() && peek() != '|' && peek() != ')') {
			RegexNode part = parseQuantified();
			if (!(part instanceof RegexNode.Empty)) {
				parts.add(part);
			}
		}
		if (parts.isEmpty()) {
			return RegexNode.EMPTY;
		}
		return parts.size() == 1 ? parts.get(0) : new RegexNode.Concat(parts);
	}

	private RegexNode parseQuantified() {
		int atomStart = pos;
		RegexNode atom = parseAtom();
		if (isAtEnd()) {
			return atom;
		}
		int min;
		int max;
		char c = peek();
		switch (c) {
			case '*' -> {
				advance();
				min = 0;
				max = RegexNode.Repeat.UNBOUNDED;
			}
			case '+' -> {
				advance();
				min = 1;
				max = RegexNode.Repeat.UNBOUNDED;
			}
			case '?' -> {
				advance();
				min = 0;
				max = 1;
			}
			case '{' -> {
				int[] bounds = parseBraces();
				min = bounds[0];
				max = bounds[1];
			}
			default -> {
				return atom;
			}
		}
		if (atom instanceof RegexNode.Empty && pos - atomStart <= 1) {
			throw error("Nothing to repeat");
		}
		// lazy and possessive suffixes do not change the language
		if (!isAtEnd() && (peek() == '?' || peek() == '+')) {
			advance();
		}
		if (!isAtEnd() && isQuantifierStart(peek())) {
			throw error("Nested quantifier '" + peek() + "'");
		}
		return new RegexNode.Repeat(atom, min, max);
	}

	private int[] parseBraces() {
		advance(); // consume '{'
		int min = parseNumber();
		int max = min;
		if (!isAtEnd() && peek() == ',') {
			advance();
			max = !isAtEnd() && isDigit(peek()) ? parseNumber() : RegexNode.Repeat.UNBOUNDED;
		}
		expect('}', "Unclosed repetition quantifier");
		if (max != RegexNode.Repeat.UNBOUNDED && max < min) {
			throw error("Repetition range out of order {" + min + "," + max + "}");
		}
		return new int[] { min, max };
	}

	private int parseNumber() {
		int start = pos;
		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}
		if (start == pos) {
			throw error("Expected a decimal number in repetition quantifier");
		}
		String digits = pattern.substring(start, pos);
		if (digits.length() > 9 || Integer.parseInt(digits) > MAX_REPEAT) {
			pos = start;
			throw error("Repetition count " + digits + " exceeds the maximum of " + MAX_REPEAT);
		}
		return Integer.parseInt(digits);
	}

	private RegexNode parseAtom() {
		char c = advance();
		return switch (c) {
			case '(' -> parseGroup();
			case '[' -> parseClass();
			case '.' -> CharClass.printable();
			case '^', '$' -> RegexNode.EMPTY;
			case '\\' -> parseEscape();
			case '*', '+', '?', '{' -> {
				pos--;
				throw error("Nothing to repeat");
			}
			default -> new RegexNode.Literal(String.valueOf(c));
		};
	}

	private RegexNode parseGroup() {
		int open = pos - 1;
		if (!isAtEnd() && peek() == '?') {
			advance();
			if (isAtEnd()) {
				throw error("Unclosed group");
			}
			char kind = advance();
			if (kind == 'P' && !isAtEnd() && peek() == '<') {
				advance();
				skipGroupName();
			} else if (kind == '<') {
				skipGroupName();
			} else if (kind != ':') {
				pos--;
				throw error("Unsupported group construct '(?" + kind + "'");
			}
		}
		RegexNode inner = parseAlternation();
		if (isAtEnd()) {
			pos = open;
			throw error("Unclosed group");
		}
		advance(); // consume ')'
		return inner;
	}

	private void skipGroupName() {
		int start = pos;
		while (!isAtEnd() && peek() != '>') {
			char c = advance();
			if (!Character.isLetterOrDigit(c) && c != '_') {
				throw error("Invalid character in group name");
			}
		}
		if (isAtEnd() || start == pos) {
			throw error("Invalid group name");
		}
		advance(); // consume '>'
	}

	private RegexNode parseClass() {
		int open = pos - 1;
		boolean negated = false;
		if (!isAtEnd() && peek() == '^') {
			advance();
			negated = true;
		}
		List<CharRange> ranges = new ArrayList<>();
		boolean first = true;
		while (true) {
			if (isAtEnd()) {
				pos = open;
				throw error("Unclosed character class");
			}
			char c = peek();
			if (c == ']' && !first) {
				advance();
				break;
			}
			first = false;
			advance();
			if (c == '\\') {
				CharClass escaped = parseClassEscape();
				if (escaped.size() > 1) {
					ranges.addAll(escaped.ranges());
					continue;
				}
				c = escaped.memberAt(0);
			}
			if (!isAtEnd() && peek() == '-' && pos + 1 < pattern.length() && pattern.charAt(pos + 1) != ']') {
				advance(); // consume '-'
				char end = advance();
				if (end == '\\') {
					CharClass escaped = parseClassEscape();
					if (escaped.size() > 1) {
						throw error("Invalid range end in character class");
					}
					end = escaped.memberAt(0);
				}
				if (end < c) {
					throw error("Character class range out of order " + c + "-" + end);
				}
				ranges.add(new CharRange(c, end));
			} else {
				ranges.add(CharRange.single(c));
			}
		}
		CharClass cls = new CharClass(ranges);
		if (negated) {
			cls = cls.complement();
		}
		if (cls.isEmpty()) {
			pos = open;
			throw error("Character class matches nothing");
		}
		return cls;
	}

	private CharClass parseClassEscape() {
		if (!isAtEnd() && peek() == 'b') {
			advance();
			return CharClass.of(CharRange.single('\b'));
		}
		RegexNode node = parseEscape();
		if (node instanceof CharClass cls) {
			return cls;
		}
		if (node instanceof RegexNode.Literal literal) {
			return CharClass.of(CharRange.single(literal.text().charAt(0)));
		}
		throw error("Assertion escape not allowed in character class");
	}

	private RegexNode parseEscape() {
		if (isAtEnd()) {
			throw error("Trailing backslash");
		}
		char c = advance();
		return switch (c) {
			case 'd' -> digits();
			case 'D' -> digits().complement();
			case 'w' -> word();
			case 'W' -> word().complement();
			case 's' -> whitespace();
			case 'S' -> whitespace().complement();
			case 'b', 'B', 'A', 'z', 'Z' -> RegexNode.EMPTY;
			case 'n' -> new RegexNode.Literal("\n");
			case 't' -> new RegexNode.Literal("\t");
			case 'r' -> new RegexNode.Literal("\r");
			case 'f' -> new RegexNode.Literal("\f");
			case 'v' -> new RegexNode.Literal("\u000B");
			case 'x' -> new RegexNode.Literal(String.valueOf(parseHex(2)));
			case 'u' -> new RegexNode.Literal(String.valueOf(parseHex(4)));
			default -> {
				if (Character.isLetterOrDigit(c)) {
					pos--;
					throw error("Unsupported escape '\\" + c + "'");
				}
				yield new RegexNode.Literal(String.valueOf(c));
			}
		};
	}

	private char parseHex(int digits) {
		if (pos + digits > pattern.length()) {
			throw error("Incomplete hex escape");
		}
		String hex = pattern.substring(pos, pos + digits);
		try {
			int value = Integer.parseInt(hex, 16);
			pos += digits;
			return (char) value;
		} catch (NumberFormatException e) {
			throw error("Invalid hex escape '" + hex + "'");
		}
	}

	private static CharClass digits() {
		return CharClass.of(new CharRange('0', '9'));
	}

	private static CharClass word() {
		return CharClass.of(
				new CharRange('a', 'z'),
				new CharRange('A', 'Z'),
				new CharRange('0', '9'),
				CharRange.single('_'));
	}

	private static CharClass whitespace() {
		return CharClass.of(
				CharRange.single(' '),
				new CharRange('\t', '\r'));
	}

	private void expect(char expected, String message) {
		if (isAtEnd() || peek() != expected) {
			throw error(message);
		}
		advance();
	}

	private static boolean isQuantifierStart(char c) {
		return c == '*' || c == '+' || c == '?' || c == '{';
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isAtEnd() {
		return pos >= pattern.length();
	}

	private char peek() {
		return pattern.charAt(pos);
	}

	private char advance() {
		return pattern.charAt(pos++);
	}

	private RegexCompileException error(String reason) {
		return new RegexCompileException(pattern, Math.min(pos, pattern.length()), reason);
	}
}
