package org.javai.bnfgen.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the grammar DSL.
 * Whitespace, {@code //} comments and {@code #} comments are skipped.
 */
public class BnfTokenizer {

	private final String input;
	private int pos = 0;

	public BnfTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws BnfParseException if an unexpected character or unterminated string is found
	 */
	public List<BnfToken> tokenize() {
		List<BnfToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new BnfToken(BnfToken.TokenType.EOF, "", pos, pos));
		return tokens;
	}

	private BnfToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '<' -> single(BnfToken.TokenType.LANGLE);
			case '>' -> single(BnfToken.TokenType.RANGLE);
			case '|' -> single(BnfToken.TokenType.PIPE);
			case ';' -> single(BnfToken.TokenType.SEMICOLON);
			case '{' -> single(BnfToken.TokenType.LBRACE);
			case '}' -> single(BnfToken.TokenType.RBRACE);
			case ',' -> single(BnfToken.TokenType.COMMA);
			case '(' -> single(BnfToken.TokenType.LPAREN);
			case ')' -> single(BnfToken.TokenType.RPAREN);
			case ':' -> {
				if (input.startsWith("::=", pos)) {
					pos += 3;
					yield new BnfToken(BnfToken.TokenType.DEFINE, "::=", start, pos);
				}
				yield single(BnfToken.TokenType.COLON);
			}
			case '"' -> scanString();
			default -> {
				if (isIdentifierChar(c)) {
					yield scanWord();
				}
				throw new BnfParseException("Unexpected character '" + c + "'", pos);
			}
		};
	}

	private BnfToken single(BnfToken.TokenType type) {
		int start = pos;
		char c = advance();
		return new BnfToken(type, String.valueOf(c), start, pos);
	}

	private BnfToken scanString() {
		int start = pos;
		advance(); // opening quote

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '"') {
			char c = advance();
			if (c == '\\') {
				if (isAtEnd()) {
					break;
				}
				int escapeAt = pos - 1;
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					case 'r' -> '\r';
					case '"' -> '"';
					case '\\' -> '\\';
					default -> throw new BnfParseException("Unsupported escape '\\" + next + "' in string", escapeAt);
				});
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			throw new BnfParseException("Unterminated string", start);
		}

		advance(); // closing quote
		return new BnfToken(BnfToken.TokenType.STRING, sb.toString(), start, pos);
	}

	/**
	 * Identifiers may contain digits and dashes, so a word made only of digits is an integer.
	 */
	private BnfToken scanWord() {
		int start = pos;
		boolean digitsOnly = true;
		while (!isAtEnd() && isIdentifierChar(peek())) {
			digitsOnly &= isDigit(advance());
		}
		String value = input.substring(start, pos);
		BnfToken.TokenType type = digitsOnly ? BnfToken.TokenType.INTEGER : BnfToken.TokenType.IDENTIFIER;
		return new BnfToken(type, value, start, pos);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (isWhitespace(c)) {
				advance();
			} else if (c == '#' || input.startsWith("//", pos)) {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else {
				return;
			}
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierChar(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDigit(c) || c == '_' || c == '-';
	}
}
