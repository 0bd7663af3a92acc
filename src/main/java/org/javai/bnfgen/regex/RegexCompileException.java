package org.javai.bnfgen.regex;

/**
 * Thrown when a {@code re("...")} pattern cannot be compiled.
 */
public class RegexCompileException extends RuntimeException {

	private final String pattern;
	private final int index;
	private final String reason;

	public RegexCompileException(String pattern, int index, String reason) {
		super(reason + " at index " + index + " in pattern '" + pattern + "'");
		this.pattern = pattern;
		this.index = index;
		this.reason = reason;
	}

	public String pattern() {
		return pattern;
	}

	/**
	 * Offset into the pattern where compilation failed.
	 */
	public int index() {
		return index;
	}

	public String reason() {
		return reason;
	}
}
