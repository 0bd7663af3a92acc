package org.javai.bnfgen.gen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.random.RandomGenerator;
import org.javai.bnfgen.grammar.CheckedGrammar;
import org.javai.bnfgen.grammar.GenerationState;
import org.javai.bnfgen.grammar.NonTerminal;
import org.javai.bnfgen.grammar.Reduction;
import org.javai.bnfgen.grammar.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives flat strings from a {@link CheckedGrammar}.
 * <p>
 * Expansion is iterative: pending symbols live on an explicit stack, so deep
 * derivations do not consume the call stack. The left-most pending symbol is always
 * reduced first and emitted terminals are joined with {@link GeneratorSettings#separator()}.
 * <p>
 * A generator holds no per-run state and may be shared between threads.
 */
public final class Generator {

	private static final Logger logger = LoggerFactory.getLogger(Generator.class);

	private final CheckedGrammar grammar;
	private final GeneratorSettings settings;

	public Generator(CheckedGrammar grammar) {
		this(grammar, GeneratorSettings.defaults());
	}

	public Generator(CheckedGrammar grammar, GeneratorSettings settings) {
		this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	public CheckedGrammar grammar() {
		return grammar;
	}

	public GeneratorSettings settings() {
		return settings;
	}

	/**
	 * A fresh run from {@code start}; a {@code null} seed draws a random one.
	 */
	public GenerationRun newRun(NonTerminal start, Long seed) {
		return new GenerationRun(grammar, start, settings, GenerationState.seeded(seed));
	}

	public String generate(String start, Long seed) {
		return generate(NonTerminal.untyped(start), seed);
	}

	/**
	 * Derive one string. The same grammar, start and seed always give the same output.
	 */
	public String generate(NonTerminal start, Long seed) {
		return generate(newRun(start, seed));
	}

	public String generate(NonTerminal start, RandomGenerator random) {
		return generate(new GenerationRun(grammar, start, settings, new GenerationState(random)));
	}

	/**
	 * Execute {@code run}, which must not have been executed before.
	 */
	public String generate(GenerationRun run) {
		Objects.requireNonNull(run, "run must not be null");
		return run.execute(root -> expand(run, root));
	}

	/**
	 * Derive {@code count} strings from a single random sequence seeded with {@code seed}.
	 * Runs that hit the step ceiling are retried, up to {@link GeneratorSettings#maxAttempts()}
	 * times per output. Other generation failures propagate immediately.
	 *
	 * @throws StepLimitExceededException if an output could not be derived within its attempts
	 */
	public List<String> generateMany(NonTerminal start, int count, Long seed) {
		Objects.requireNonNull(start, "start must not be null");
		if (count < 0) {
			throw new IllegalArgumentException("count must not be negative, was " + count);
		}
		RandomGenerator random = seed != null ? new Random(seed) : new Random();
		List<String> outputs = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			outputs.add(generateWithRetry(start, random));
		}
		return outputs;
	}

	private String generateWithRetry(NonTerminal start, RandomGenerator random) {
		StepLimitExceededException last = null;
		for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
			try {
				return generate(start, random);
			}
			catch (StepLimitExceededException ex) {
				logger.debug("Attempt {} from {} exceeded {} steps, retrying", attempt, start, settings.maxSteps());
				last = ex;
			}
		}
		logger.warn("Giving up on {} after {} attempts", start, settings.maxAttempts());
		throw last;
	}

	private String expand(GenerationRun run, Symbol root) {
		StringBuilder out = new StringBuilder();
		boolean first = true;
		Deque<Symbol> pending = new ArrayDeque<>();
		pending.push(root);
		while (!pending.isEmpty()) {
			Reduction reduction = run.reduce(pending.pop());
			if (reduction instanceof Reduction.Emit emit) {
				if (!first) {
					out.append(settings.separator());
				}
				out.append(emit.text());
				first = false;
			}
			else {
				List<Symbol> symbols = ((Reduction.Expand) reduction).symbols();
				for (int i = symbols.size() - 1; i >= 0; i--) {
					pending.push(symbols.get(i));
				}
			}
		}
		return out.toString();
	}
}
