package org.javai.bnfgen;

/**
 * Base class for failures that abort a single generation run. The grammar and any
 * other runs sharing it are unaffected.
 */
public abstract class GenerationException extends RuntimeException {

	protected GenerationException(String message) {
		super(message);
	}

	protected GenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
