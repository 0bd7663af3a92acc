package org.javai.bnfgen.parse;

/**
 * Exception thrown when grammar source text cannot be tokenized or parsed.
 */
public class BnfParseException extends RuntimeException {

	private final int position;

	public BnfParseException(String message, int position) {
		super(message + " at position " + position);
		this.position = position;
	}

	public BnfParseException(String message, int position, Throwable cause) {
		super(message + " at position " + position, cause);
		this.position = position;
	}

	/**
	 * Offset into the source where the problem was found.
	 */
	public int position() {
		return position;
	}
}
