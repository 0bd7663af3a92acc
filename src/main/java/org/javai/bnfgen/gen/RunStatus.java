package org.javai.bnfgen.gen;

/**
 * Lifecycle of a {@link GenerationRun}: {@code IDLE -> EXPANDING -> DONE | FAILED}.
 */
public enum RunStatus {
	IDLE,
	EXPANDING,
	DONE,
	FAILED;

	public boolean isTerminal() {
		return this == DONE || this == FAILED;
	}
}
