package org.javai.bnfgen.regex;

import org.javai.bnfgen.GenerationException;

/**
 * Thrown when a regex terminal keeps producing strings that collide with literal
 * terminals of the grammar.
 */
public class RegexAvoidRetryExceededException extends GenerationException {

	private final String pattern;
	private final int attempts;

	public RegexAvoidRetryExceededException(String pattern, int attempts) {
		super("Pattern '" + pattern + "' produced only literal terminals of the grammar in " + attempts + " attempts");
		this.pattern = pattern;
		this.attempts = attempts;
	}

	public String pattern() {
		return pattern;
	}

	public int attempts() {
		return attempts;
	}
}
