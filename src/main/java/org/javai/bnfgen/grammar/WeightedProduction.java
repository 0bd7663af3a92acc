package org.javai.bnfgen.grammar;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Right-hand side of a rule: its alternatives in declaration order.
 */
public record WeightedProduction(List<Alternative> alternatives) {

	public WeightedProduction {
		Objects.requireNonNull(alternatives, "alternatives must not be null");
		if (alternatives.isEmpty()) {
			throw new IllegalArgumentException("A production needs at least one alternative");
		}
		alternatives = List.copyOf(alternatives);
	}

	public static WeightedProduction of(Alternative... alternatives) {
		return new WeightedProduction(List.of(alternatives));
	}

	public Stream<String> literals() {
		return alternatives.stream().flatMap(Alternative::literals);
	}

	@Override
	public String toString() {
		return alternatives.stream().map(Alternative::toString).collect(Collectors.joining(" | "));
	}
}
