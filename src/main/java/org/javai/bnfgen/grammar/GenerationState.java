package org.javai.bnfgen.grammar;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Mutable state of one generation run: the random source and how often each
 * alternative has been selected so far.
 * <p>
 * A state belongs to exactly one run and is never shared between threads. It is
 * passed explicitly to every {@link CheckedGrammar#reduce(Symbol, GenerationState)} call.
 */
public final class GenerationState {

	private final RandomGenerator random;
	private final Map<Alternative, Integer> selections = new IdentityHashMap<>();
	private long reductions;

	public GenerationState(RandomGenerator random) {
		this.random = Objects.requireNonNull(random, "random must not be null");
	}

	/**
	 * State seeded for reproducible output. A {@code null} seed draws a fresh random seed.
	 */
	public static GenerationState seeded(Long seed) {
		return new GenerationState(seed != null ? new Random(seed) : new Random());
	}

	public RandomGenerator random() {
		return random;
	}

	public int selections(Alternative alternative) {
		return selections.getOrDefault(alternative, 0);
	}

	void recordSelection(Alternative alternative) {
		selections.merge(alternative, 1, Integer::sum);
	}

	/**
	 * Number of {@code reduce} calls made against this state.
	 */
	public long reductions() {
		return reductions;
	}

	void recordReduction() {
		reductions++;
	}
}
