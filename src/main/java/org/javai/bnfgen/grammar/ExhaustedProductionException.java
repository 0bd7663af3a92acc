package org.javai.bnfgen.grammar;

import java.util.List;
import org.javai.bnfgen.GenerationException;

/**
 * Thrown when every alternative a non-terminal could expand to has used up its
 * invoke limit in the current run.
 */
public class ExhaustedProductionException extends GenerationException {

	private final NonTerminal nonTerminal;
	private final List<Alternative> candidates;

	public ExhaustedProductionException(NonTerminal nonTerminal, List<Alternative> candidates) {
		super("No alternative of " + nonTerminal + " is still within its invoke limit; candidates: " + candidates);
		this.nonTerminal = nonTerminal;
		this.candidates = List.copyOf(candidates);
	}

	public NonTerminal nonTerminal() {
		return nonTerminal;
	}

	public List<Alternative> candidates() {
		return candidates;
	}
}
