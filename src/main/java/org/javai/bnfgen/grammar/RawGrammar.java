package org.javai.bnfgen.grammar;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Rules exactly as written in the source, before any validation. May reference
 * undefined rules, declare duplicates or carry malformed invoke limits.
 */
public record RawGrammar(List<Rule> rules) {

	public RawGrammar {
		Objects.requireNonNull(rules, "rules must not be null");
		rules = List.copyOf(rules);
	}

	public static RawGrammar of(Rule... rules) {
		return new RawGrammar(List.of(rules));
	}

	public boolean isEmpty() {
		return rules.isEmpty();
	}

	/**
	 * Every symbol on every right-hand side, in source order.
	 */
	public Stream<Symbol> symbols() {
		return rules.stream()
				.flatMap(r -> r.alternatives().stream())
				.flatMap(a -> a.symbols().stream());
	}

	@Override
	public String toString() {
		return rules.stream().map(Rule::toString).collect(Collectors.joining("\n"));
	}
}
