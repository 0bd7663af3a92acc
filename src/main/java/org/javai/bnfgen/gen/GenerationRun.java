package org.javai.bnfgen.gen;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.javai.bnfgen.GenerationException;
import org.javai.bnfgen.grammar.CheckedGrammar;
import org.javai.bnfgen.grammar.GenerationState;
import org.javai.bnfgen.grammar.NonTerminal;
import org.javai.bnfgen.grammar.Reduction;
import org.javai.bnfgen.grammar.Span;
import org.javai.bnfgen.grammar.Symbol;

/**
 * A single derivation from one start symbol.
 * <p>
 * A run owns its {@link GenerationState} and executes exactly once. Every reduction
 * goes through {@link #reduce(Symbol)}, which enforces the step ceiling.
 */
public final class GenerationRun {

	private final CheckedGrammar grammar;
	private final NonTerminal start;
	private final GeneratorSettings settings;
	private final GenerationState state;
	private RunStatus status = RunStatus.IDLE;
	private GenerationException failure;

	public GenerationRun(CheckedGrammar grammar, NonTerminal start, GeneratorSettings settings, GenerationState state) {
		this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
		this.start = Objects.requireNonNull(start, "start must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.state = Objects.requireNonNull(state, "state must not be null");
	}

	/**
	 * Drive the run with {@code expansion}, which receives the start reference and
	 * reduces symbols through this run.
	 *
	 * @throws IllegalStateException if the run was already executed
	 * @throws GenerationException if the expansion fails; the run is then {@link RunStatus#FAILED},
	 *         as it is for any other exception or error thrown by {@code expansion}
	 */
	<T> T execute(Function<Symbol.NonTerminalRef, T> expansion) {
		if (status != RunStatus.IDLE) {
			throw new IllegalStateException("Generation run already " + status);
		}
		if (!grammar.defines(start)) {
			throw new IllegalArgumentException("Start symbol " + start + " is not defined in the grammar");
		}
		status = RunStatus.EXPANDING;
		try {
			T result = expansion.apply(new Symbol.NonTerminalRef(start, Span.UNKNOWN));
			status = RunStatus.DONE;
			return result;
		}
		catch (GenerationException ex) {
			failure = ex;
			throw ex;
		}
		finally {
			if (status == RunStatus.EXPANDING) {
				status = RunStatus.FAILED;
			}
		}
	}

	/**
	 * Reduce one symbol against the grammar, counting it towards the step ceiling.
	 */
	Reduction reduce(Symbol symbol) {
		if (status != RunStatus.EXPANDING) {
			throw new IllegalStateException("Cannot reduce while run is " + status);
		}
		if (state.reductions() >= settings.maxSteps()) {
			throw new StepLimitExceededException(settings.maxSteps());
		}
		return grammar.reduce(symbol, state);
	}

	public RunStatus status() {
		return status;
	}

	public NonTerminal start() {
		return start;
	}

	public GeneratorSettings settings() {
		return settings;
	}

	/**
	 * Reductions performed so far.
	 */
	public long steps() {
		return state.reductions();
	}

	public Optional<GenerationException> failure() {
		return Optional.ofNullable(failure);
	}
}
