package org.javai.bnfgen.grammar;

import java.util.List;
import java.util.Objects;

public record Rule(NonTerminal lhs, WeightedProduction production, Span span) {

	public Rule {
		Objects.requireNonNull(lhs, "lhs must not be null");
		Objects.requireNonNull(production, "production must not be null");
		Objects.requireNonNull(span, "span must not be null");
	}

	public static Rule of(NonTerminal lhs, Alternative... alternatives) {
		return new Rule(lhs, WeightedProduction.of(alternatives), Span.UNKNOWN);
	}

	public List<Alternative> alternatives() {
		return production.alternatives();
	}

	@Override
	public String toString() {
		return lhs + " ::= " + production + " ;";
	}
}
