package org.javai.bnfgen.grammar;

import java.util.List;

/**
 * Outcome of reducing one symbol.
 */
public sealed interface Reduction {

	/**
	 * Text to append to the output, from a literal or a regex terminal.
	 */
	record Emit(String text) implements Reduction {
	}

	/**
	 * The alternative chosen for a non-terminal; its symbols replace the reference.
	 */
	record Expand(NonTerminal reference, NonTerminal rule, Alternative chosen) implements Reduction {
		public List<Symbol> symbols() {
			return chosen.symbols();
		}
	}
}
