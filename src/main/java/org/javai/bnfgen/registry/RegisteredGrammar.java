package org.javai.bnfgen.registry;

import java.util.Objects;
import org.javai.bnfgen.grammar.CheckedGrammar;
import org.javai.bnfgen.validate.DiagnosticSet;

/**
 * A validated grammar together with the source it was compiled from.
 *
 * @param id registry key
 * @param source grammar text, kept for rendering diagnostics
 * @param grammar the checked grammar
 * @param diagnostics advisory findings of validation
 */
public record RegisteredGrammar(String id, String source, CheckedGrammar grammar, DiagnosticSet diagnostics) {

	public RegisteredGrammar {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(grammar, "grammar must not be null");
		Objects.requireNonNull(diagnostics, "diagnostics must not be null");
	}
}
