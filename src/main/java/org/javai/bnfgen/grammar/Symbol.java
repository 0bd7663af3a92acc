package org.javai.bnfgen.grammar;

import java.util.Objects;

/**
 * One element on the right-hand side of an alternative.
 */
public sealed interface Symbol {

	Span span();

	/**
	 * Whether this symbol emits text directly rather than expanding further.
	 */
	default boolean isTerminal() {
		return !(this instanceof NonTerminalRef);
	}

	static Terminal terminal(String literal) {
		return new Terminal(literal, Span.UNKNOWN);
	}

	static NonTerminalRef ref(String name) {
		return new NonTerminalRef(NonTerminal.untyped(name), Span.UNKNOWN);
	}

	static NonTerminalRef ref(String name, String typeTag) {
		return new NonTerminalRef(NonTerminal.typed(name, typeTag), Span.UNKNOWN);
	}

	static Regex regex(String pattern) {
		return new Regex(pattern, Span.UNKNOWN);
	}

	/**
	 * Literal text emitted verbatim.
	 */
	record Terminal(String literal, Span span) implements Symbol {
		public Terminal {
			Objects.requireNonNull(literal, "literal must not be null");
			Objects.requireNonNull(span, "span must not be null");
		}

		@Override
		public String toString() {
			return "\"" + literal + "\"";
		}
	}

	/**
	 * Reference to a rule, resolved by name and optional type tag.
	 */
	record NonTerminalRef(NonTerminal target, Span span) implements Symbol {
		public NonTerminalRef {
			Objects.requireNonNull(target, "target must not be null");
			Objects.requireNonNull(span, "span must not be null");
		}

		@Override
		public String toString() {
			return target.toString();
		}
	}

	/**
	 * Terminal whose text is synthesized from a regular expression. The pattern is
	 * compiled during validation.
	 */
	record Regex(String pattern, Span span) implements Symbol {
		public Regex {
			Objects.requireNonNull(pattern, "pattern must not be null");
			Objects.requireNonNull(span, "span must not be null");
		}

		@Override
		public String toString() {
			return "re(\"" + pattern + "\")";
		}
	}
}
