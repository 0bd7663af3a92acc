package org.javai.bnfgen.grammar;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * One weighted, optionally limited branch of a rule.
 * <p>
 * Invocation counters in {@link GenerationState} are keyed by instance identity, so two
 * alternatives with equal contents in different rules are still counted separately.
 */
public record Alternative(List<Symbol> symbols, int weight, InvokeLimit invokeLimit, Span span) {

	public static final int DEFAULT_WEIGHT = 1;

	public Alternative {
		Objects.requireNonNull(symbols, "symbols must not be null");
		Objects.requireNonNull(invokeLimit, "invokeLimit must not be null");
		Objects.requireNonNull(span, "span must not be null");
		if (symbols.isEmpty()) {
			throw new IllegalArgumentException("An alternative needs at least one symbol");
		}
		if (weight < 1) {
			throw new IllegalArgumentException("Alternative weight must be at least 1, was " + weight);
		}
		symbols = List.copyOf(symbols);
	}

	public static Alternative of(Symbol... symbols) {
		return new Alternative(List.of(symbols), DEFAULT_WEIGHT, InvokeLimit.unlimited(), Span.UNKNOWN);
	}

	public Alternative withWeight(int newWeight) {
		return new Alternative(symbols, newWeight, invokeLimit, span);
	}

	public Alternative withLimit(InvokeLimit limit) {
		return new Alternative(symbols, weight, limit, span);
	}

	/**
	 * Literal terminals of this alternative, excluding regex terminals.
	 */
	public Stream<String> literals() {
		return symbols.stream()
				.filter(Symbol.Terminal.class::isInstance)
				.map(s -> ((Symbol.Terminal) s).literal());
	}

	public Stream<NonTerminal> references() {
		return symbols.stream()
				.filter(Symbol.NonTerminalRef.class::isInstance)
				.map(s -> ((Symbol.NonTerminalRef) s).target());
	}

	@Override
	public boolean equals(Object o) {
		return this == o;
	}

	@Override
	public int hashCode() {
		return System.identityHashCode(this);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (weight != DEFAULT_WEIGHT) {
			sb.append(weight).append(' ');
		}
		for (int i = 0; i < symbols.size(); i++) {
			if (i > 0) {
				sb.append(' ');
			}
			sb.append(symbols.get(i));
		}
		String limit = invokeLimit.toString();
		if (!limit.isEmpty()) {
			sb.append(' ').append(limit);
		}
		return sb.toString();
	}
}
