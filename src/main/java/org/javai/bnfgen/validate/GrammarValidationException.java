package org.javai.bnfgen.validate;

/**
 * Thrown when a grammar with blocking findings is asked for its checked form.
 */
public class GrammarValidationException extends RuntimeException {

	private final DiagnosticSet diagnostics;

	public GrammarValidationException(DiagnosticSet diagnostics) {
		super(describe(diagnostics));
		this.diagnostics = diagnostics;
	}

	public DiagnosticSet diagnostics() {
		return diagnostics;
	}

	private static String describe(DiagnosticSet diagnostics) {
		int errors = diagnostics.errors().size();
		return "Grammar has " + errors + (errors == 1 ? " error" : " errors") + ":\n" + diagnostics;
	}
}
