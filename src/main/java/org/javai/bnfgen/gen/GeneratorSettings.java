package org.javai.bnfgen.gen;

import java.util.Objects;

/**
 * Settings shared by the generators.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * GeneratorSettings settings = GeneratorSettings.defaults();
 *
 * // Custom settings
 * GeneratorSettings settings = GeneratorSettings.builder()
 *         .separator("")
 *         .maxSteps(10_000)
 *         .build();
 * }</pre>
 *
 * @param separator text placed between consecutive terminals of a flat output
 * @param maxSteps maximum number of symbol reductions in one run, {@link #UNLIMITED_STEPS} for no ceiling
 * @param maxAttempts how many runs batch generation tries per output before giving up
 */
public record GeneratorSettings(
		String separator,
		long maxSteps,
		int maxAttempts
) {

	public static final String DEFAULT_SEPARATOR = " ";

	public static final long UNLIMITED_STEPS = Long.MAX_VALUE;

	public static final int DEFAULT_MAX_ATTEMPTS = 100;

	public GeneratorSettings {
		Objects.requireNonNull(separator, "separator must not be null");
		if (maxSteps < 1) {
			throw new IllegalArgumentException("maxSteps must be positive, was " + maxSteps);
		}
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be positive, was " + maxAttempts);
		}
	}

	public static GeneratorSettings defaults() {
		return new GeneratorSettings(DEFAULT_SEPARATOR, UNLIMITED_STEPS, DEFAULT_MAX_ATTEMPTS);
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean hasStepLimit() {
		return maxSteps != UNLIMITED_STEPS;
	}

	/**
	 * Builder for {@link GeneratorSettings}.
	 */
	public static class Builder {
		private String separator = DEFAULT_SEPARATOR;
		private long maxSteps = UNLIMITED_STEPS;
		private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

		private Builder() {}

		public Builder separator(String separator) {
			this.separator = separator;
			return this;
		}

		/**
		 * Caps the number of reductions per run. Runs over the ceiling fail with
		 * {@link StepLimitExceededException}.
		 */
		public Builder maxSteps(long maxSteps) {
			this.maxSteps = maxSteps;
			return this;
		}

		public Builder unlimitedSteps() {
			this.maxSteps = UNLIMITED_STEPS;
			return this;
		}

		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
			return this;
		}

		public GeneratorSettings build() {
			return new GeneratorSettings(separator, maxSteps, maxAttempts);
		}
	}
}
