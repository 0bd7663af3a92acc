package org.javai.bnfgen.config;

/**
 * Exception thrown when generator settings cannot be read or are malformed.
 */
public class SettingsLoadException extends RuntimeException {

	public SettingsLoadException(String message) {
		super(message);
	}

	public SettingsLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
