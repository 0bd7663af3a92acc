package org.javai.bnfgen.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.bnfgen.regex.RegexSynthesizer;

/**
 * A validated grammar, indexed for generation.
 * <p>
 * Every reference resolves, every invoke limit has {@code min <= max} and every regex
 * terminal is compiled. Instances are immutable and can be shared by any number of
 * concurrent runs, each with its own {@link GenerationState}.
 * <p>
 * Obtain one from {@code GrammarValidator}; {@link #of(List, Map)} re-checks the
 * invariants it relies on and rejects anything else.
 */
public final class CheckedGrammar {

	private final Map<NonTerminal, WeightedProduction> rules;
	private final Map<String, List<Alternative>> alternativesByName;
	private final Map<Alternative, NonTerminal> owners;
	private final Map<String, RegexSynthesizer> patterns;
	private final Set<String> literals;

	private CheckedGrammar(Map<NonTerminal, WeightedProduction> rules,
						   Map<String, List<Alternative>> alternativesByName,
						   Map<Alternative, NonTerminal> owners,
						   Map<String, RegexSynthesizer> patterns,
						   Set<String> literals) {
		this.rules = rules;
		this.alternativesByName = alternativesByName;
		this.owners = owners;
		this.patterns = patterns;
		this.literals = literals;
	}

	/**
	 * Index already-validated rules.
	 *
	 * @param rules rules with distinct identities
	 * @param patterns compiled synthesizer for every regex pattern the rules use
	 * @throws IllegalArgumentException if an invariant does not hold
	 */
	public static CheckedGrammar of(List<Rule> rules, Map<String, RegexSynthesizer> patterns) {
		Objects.requireNonNull(rules, "rules must not be null");
		Objects.requireNonNull(patterns, "patterns must not be null");

		Map<NonTerminal, WeightedProduction> byIdentity = new LinkedHashMap<>();
		Map<String, List<Alternative>> byName = new LinkedHashMap<>();
		Map<Alternative, NonTerminal> owners = new IdentityHashMap<>();
		Set<String> literals = new LinkedHashSet<>();
		for (Rule rule : rules) {
			if (byIdentity.putIfAbsent(rule.lhs(), rule.production()) != null) {
				throw new IllegalArgumentException("Duplicate rule " + rule.lhs());
			}
			for (Alternative alternative : rule.alternatives()) {
				byName.computeIfAbsent(rule.lhs().name(), k -> new ArrayList<>()).add(alternative);
				owners.put(alternative, rule.lhs());
				if (alternative.invokeLimit() instanceof InvokeLimit.Limited limited && !limited.isValidRange()) {
					throw new IllegalArgumentException("Invalid invoke limit " + limited + " in " + rule.lhs());
				}
			}
			rule.production().literals().forEach(literals::add);
		}

		CheckedGrammar grammar = new CheckedGrammar(
				Collections.unmodifiableMap(byIdentity),
				freeze(byName),
				Collections.unmodifiableMap(owners),
				Map.copyOf(patterns),
				Collections.unmodifiableSet(literals));

		for (Rule rule : rules) {
			for (Alternative alternative : rule.alternatives()) {
				for (Symbol symbol : alternative.symbols()) {
					if (symbol instanceof Symbol.NonTerminalRef ref && grammar.candidates(ref.target()).isEmpty()) {
						throw new IllegalArgumentException("Undefined non-terminal " + ref.target() + " in " + rule.lhs());
					}
					if (symbol instanceof Symbol.Regex regex && !grammar.patterns.containsKey(regex.pattern())) {
						throw new IllegalArgumentException("Pattern '" + regex.pattern() + "' was not compiled");
					}
				}
			}
		}
		return grammar;
	}

	private static Map<String, List<Alternative>> freeze(Map<String, List<Alternative>> byName) {
		Map<String, List<Alternative>> frozen = new LinkedHashMap<>();
		byName.forEach((name, alternatives) -> frozen.put(name, List.copyOf(alternatives)));
		return Collections.unmodifiableMap(frozen);
	}

	/**
	 * Rules in declaration order.
	 */
	public Map<NonTerminal, WeightedProduction> rules() {
		return rules;
	}

	public Optional<WeightedProduction> production(NonTerminal identity) {
		return Optional.ofNullable(rules.get(identity));
	}

	public boolean defines(NonTerminal reference) {
		return !candidates(reference).isEmpty();
	}

	/**
	 * Literal terminals of the whole grammar; regex output never equals one of these.
	 */
	public Set<String> literals() {
		return literals;
	}

	/**
	 * Alternatives a reference may expand to: the exact rule for a typed reference,
	 * the union over all same-named rules otherwise.
	 */
	public List<Alternative> candidates(NonTerminal reference) {
		if (reference.isTyped()) {
			WeightedProduction production = rules.get(reference);
			return production != null ? production.alternatives() : List.of();
		}
		return alternativesByName.getOrDefault(reference.name(), List.of());
	}

	/**
	 * Resolve one symbol to its next expansion.
	 * <ul>
	 * <li>a literal is emitted unchanged;</li>
	 * <li>a regex terminal is synthesized, avoiding every literal of the grammar;</li>
	 * <li>a non-terminal picks one eligible alternative, weighted, and counts the selection.</li>
	 * </ul>
	 * An alternative is eligible while its selection count is below its maximum. If any
	 * eligible alternative has not yet reached its minimum, only those are considered.
	 *
	 * @throws ExhaustedProductionException if no candidate alternative is eligible
	 * @throws org.javai.bnfgen.regex.RegexAvoidRetryExceededException if a regex terminal
	 *         cannot avoid the literals
	 */
	public Reduction reduce(Symbol symbol, GenerationState state) {
		Objects.requireNonNull(symbol, "symbol must not be null");
		Objects.requireNonNull(state, "state must not be null");
		state.recordReduction();
		if (symbol instanceof Symbol.Terminal terminal) {
			return new Reduction.Emit(terminal.literal());
		}
		if (symbol instanceof Symbol.Regex regex) {
			RegexSynthesizer synthesizer = patterns.get(regex.pattern());
			if (synthesizer == null) {
				throw new IllegalStateException("Pattern '" + regex.pattern() + "' is not part of this grammar");
			}
			return new Reduction.Emit(synthesizer.generate(state.random(), literals));
		}
		NonTerminal reference = ((Symbol.NonTerminalRef) symbol).target();
		List<Alternative> candidates = candidates(reference);
		if (candidates.isEmpty()) {
			throw new IllegalStateException("Non-terminal " + reference + " is not defined in this grammar");
		}
		Alternative chosen = choose(reference, candidates, state);
		state.recordSelection(chosen);
		return new Reduction.Expand(reference, owners.get(chosen), chosen);
	}

	private static Alternative choose(NonTerminal reference, List<Alternative> candidates, GenerationState state) {
		List<Alternative> eligible = new ArrayList<>(candidates.size());
		List<Alternative> owing = new ArrayList<>();
		for (Alternative alternative : candidates) {
			int count = state.selections(alternative);
			if (alternative.invokeLimit().allowsAnother(count)) {
				eligible.add(alternative);
				if (alternative.invokeLimit().belowMinimum(count)) {
					owing.add(alternative);
				}
			}
		}
		if (eligible.isEmpty()) {
			throw new ExhaustedProductionException(reference, candidates);
		}
		List<Alternative> pool = owing.isEmpty() ? eligible : owing;
		if (pool.size() == 1) {
			return pool.get(0);
		}

		long total = 0;
		for (Alternative alternative : pool) {
			total += alternative.weight();
		}
		long pick = state.random().nextLong(total);
		for (Alternative alternative : pool) {
			pick -= alternative.weight();
			if (pick < 0) {
				return alternative;
			}
		}
		return pool.get(pool.size() - 1);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		rules.forEach((lhs, production) -> sb.append(lhs).append(" ::= ").append(production).append(" ;\n"));
		return sb.toString();
	}
}
