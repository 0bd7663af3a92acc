package org.javai.bnfgen.gen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.javai.bnfgen.grammar.Alternative;
import org.javai.bnfgen.grammar.NonTerminal;

/**
 * Record of one derivation: every expanded non-terminal with the alternative chosen for
 * it, down to the emitted terminal text.
 */
public sealed interface DerivationTree {

	/**
	 * Terminal text in left-to-right order.
	 */
	default List<String> leaves() {
		List<String> leaves = new ArrayList<>();
		Deque<DerivationTree> pending = new ArrayDeque<>();
		pending.push(this);
		while (!pending.isEmpty()) {
			DerivationTree tree = pending.pop();
			if (tree instanceof Leaf leaf) {
				leaves.add(leaf.text());
			}
			else {
				List<DerivationTree> children = ((Node) tree).children();
				for (int i = children.size() - 1; i >= 0; i--) {
					pending.push(children.get(i));
				}
			}
		}
		return leaves;
	}

	/**
	 * The flat output this tree derives, leaves joined by {@code separator}.
	 */
	default String text(String separator) {
		return String.join(separator, leaves());
	}

	/**
	 * Number of nodes and leaves in the tree.
	 */
	default int size() {
		int size = 0;
		Deque<DerivationTree> pending = new ArrayDeque<>();
		pending.push(this);
		while (!pending.isEmpty()) {
			DerivationTree tree = pending.pop();
			size++;
			if (tree instanceof Node node) {
				node.children().forEach(pending::push);
			}
		}
		return size;
	}

	/**
	 * Length of the longest path from this node to a leaf, counting this node.
	 */
	default int depth() {
		int deepest = 0;
		Deque<DerivationTree> level = new ArrayDeque<>();
		level.add(this);
		while (!level.isEmpty()) {
			deepest++;
			Deque<DerivationTree> next = new ArrayDeque<>();
			for (DerivationTree tree : level) {
				if (tree instanceof Node node) {
					next.addAll(node.children());
				}
			}
			level = next;
		}
		return deepest;
	}

	/**
	 * Emitted terminal text.
	 */
	record Leaf(String text) implements DerivationTree {
		public Leaf {
			Objects.requireNonNull(text, "text must not be null");
		}
	}

	/**
	 * An expanded non-terminal.
	 *
	 * @param rule the rule that owns the chosen alternative
	 * @param reference the reference as written, which may be untyped
	 * @param alternative the alternative chosen for this expansion
	 * @param children one subtree per symbol of the alternative
	 */
	record Node(NonTerminal rule, NonTerminal reference, Alternative alternative,
				List<DerivationTree> children) implements DerivationTree {
		public Node {
			Objects.requireNonNull(rule, "rule must not be null");
			Objects.requireNonNull(reference, "reference must not be null");
			Objects.requireNonNull(alternative, "alternative must not be null");
			children = List.copyOf(children);
		}
	}
}
