package org.javai.bnfgen.gen;

import org.javai.bnfgen.GenerationException;

/**
 * Thrown when a run performs more reductions than {@link GeneratorSettings#maxSteps()} allows.
 */
public class StepLimitExceededException extends GenerationException {

	private final long maxSteps;

	public StepLimitExceededException(long maxSteps) {
		super("Generation exceeded the limit of " + maxSteps + " steps");
		this.maxSteps = maxSteps;
	}

	public long maxSteps() {
		return maxSteps;
	}
}
