package org.javai.bnfgen.validate;

/**
 * Findings a grammar validation can produce.
 */
public enum DiagnosticKind {

	UNDEFINED_SYMBOL(Severity.ERROR, "Undefined non-terminal"),
	DUPLICATE_RULE(Severity.ERROR, "Duplicated rule"),
	INVALID_LIMIT_RANGE(Severity.ERROR, "Invalid invoke limit range"),
	REGEX_COMPILE_ERROR(Severity.ERROR, "Invalid regex"),
	TRAP_LOOP(Severity.WARNING, "May be trapped in a dead loop"),
	UNREACHABLE_RULE(Severity.WARNING, "Unreachable rule");

	private final Severity severity;
	private final String title;

	DiagnosticKind(Severity severity, String title) {
		this.severity = severity;
		this.title = title;
	}

	public Severity severity() {
		return severity;
	}

	public String title() {
		return title;
	}

	/**
	 * Whether a finding of this kind prevents building a checked grammar.
	 */
	public boolean isBlocking() {
		return severity == Severity.ERROR;
	}
}
