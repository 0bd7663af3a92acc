package org.javai.bnfgen.parse;

import org.javai.bnfgen.grammar.Span;

/**
 * Represents a token of the grammar DSL.
 *
 * @param type the token type
 * @param value the token value; string literals are unescaped
 * @param start offset of the first character in the source
 * @param end offset just past the last character in the source
 */
public record BnfToken(TokenType type, String value, int start, int end) {

	public enum TokenType {
		LANGLE,        // <
		RANGLE,        // >
		COLON,         // :
		DEFINE,        // ::=
		PIPE,          // |
		SEMICOLON,     // ;
		LBRACE,        // {
		RBRACE,        // }
		COMMA,         // ,
		LPAREN,        // (
		RPAREN,        // )
		STRING,        // "quoted strings"
		INTEGER,       // non-negative integers
		IDENTIFIER,    // rule names and the re keyword
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case INTEGER, IDENTIFIER -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public Span span() {
		return Span.of(start, end);
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isIdentifier(String expected) {
		return type == TokenType.IDENTIFIER && value.equals(expected);
	}
}
