package org.javai.bnfgen.validate;

import java.util.Objects;
import java.util.Optional;
import org.javai.bnfgen.grammar.CheckedGrammar;

/**
 * Outcome of validating a grammar: the checked grammar when no blocking finding was
 * made, plus every finding, advisory ones included.
 */
public final class ValidationResult {

	private final CheckedGrammar grammar;
	private final DiagnosticSet diagnostics;

	private ValidationResult(CheckedGrammar grammar, DiagnosticSet diagnostics) {
		this.grammar = grammar;
		this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
	}

	static ValidationResult success(CheckedGrammar grammar, DiagnosticSet diagnostics) {
		return new ValidationResult(Objects.requireNonNull(grammar, "grammar must not be null"), diagnostics);
	}

	static ValidationResult failure(DiagnosticSet diagnostics) {
		if (!diagnostics.hasErrors()) {
			throw new IllegalArgumentException("A failed validation needs at least one blocking diagnostic");
		}
		return new ValidationResult(null, diagnostics);
	}

	public boolean isValid() {
		return grammar != null;
	}

	public Optional<CheckedGrammar> grammar() {
		return Optional.ofNullable(grammar);
	}

	/**
	 * The checked grammar, or an exception carrying the findings that prevented it.
	 *
	 * @throws GrammarValidationException if validation found blocking errors
	 */
	public CheckedGrammar requireGrammar() {
		if (grammar == null) {
			throw new GrammarValidationException(diagnostics);
		}
		return grammar;
	}

	public DiagnosticSet diagnostics() {
		return diagnostics;
	}
}
