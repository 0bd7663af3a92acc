package org.javai.bnfgen.graph;

import java.util.List;
import org.javai.bnfgen.grammar.NonTerminal;

/**
 * A strongly connected set of rules in which {@code trapped} rules have no way to
 * finish expanding: every alternative recurses back into the component without an
 * invoke limit to cut it off.
 *
 * @param component all rules of the strongly connected component, in declaration order
 * @param trapped the rules of the component that can never terminate
 */
public record TrapLoop(List<NonTerminal> component, List<NonTerminal> trapped) {

	public TrapLoop {
		component = List.copyOf(component);
		trapped = List.copyOf(trapped);
	}
}
