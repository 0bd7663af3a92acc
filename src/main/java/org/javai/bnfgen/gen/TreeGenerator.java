package org.javai.bnfgen.gen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;
import org.javai.bnfgen.grammar.CheckedGrammar;
import org.javai.bnfgen.grammar.GenerationState;
import org.javai.bnfgen.grammar.NonTerminal;
import org.javai.bnfgen.grammar.Reduction;
import org.javai.bnfgen.grammar.Symbol;

/**
 * Derives {@link DerivationTree}s from a {@link CheckedGrammar}.
 * <p>
 * Expansion is depth-first, left to right, so for the same seed the tree's leaves equal
 * the output of {@link Generator}. Open nodes are kept on an explicit stack, so nesting
 * depth is bounded by the heap rather than the thread stack.
 */
public final class TreeGenerator {

	private final CheckedGrammar grammar;
	private final GeneratorSettings settings;

	public TreeGenerator(CheckedGrammar grammar) {
		this(grammar, GeneratorSettings.defaults());
	}

	public TreeGenerator(CheckedGrammar grammar, GeneratorSettings settings) {
		this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	public GenerationRun newRun(NonTerminal start, Long seed) {
		return new GenerationRun(grammar, start, settings, GenerationState.seeded(seed));
	}

	public DerivationTree generate(String start, Long seed) {
		return generate(NonTerminal.untyped(start), seed);
	}

	public DerivationTree generate(NonTerminal start, Long seed) {
		return generate(newRun(start, seed));
	}

	public DerivationTree generate(NonTerminal start, RandomGenerator random) {
		return generate(new GenerationRun(grammar, start, settings, new GenerationState(random)));
	}

	public DerivationTree generate(GenerationRun run) {
		Objects.requireNonNull(run, "run must not be null");
		return run.execute(root -> derive(run, root));
	}

	private DerivationTree derive(GenerationRun run, Symbol root) {
		Reduction first = run.reduce(root);
		if (first instanceof Reduction.Emit emit) {
			return new DerivationTree.Leaf(emit.text());
		}
		Deque<Frame> open = new ArrayDeque<>();
		open.push(new Frame((Reduction.Expand) first));
		while (true) {
			Frame top = open.peek();
			if (top.hasPending()) {
				Reduction reduction = run.reduce(top.nextSymbol());
				if (reduction instanceof Reduction.Emit emit) {
					top.children.add(new DerivationTree.Leaf(emit.text()));
				}
				else {
					open.push(new Frame((Reduction.Expand) reduction));
				}
				continue;
			}
			open.pop();
			DerivationTree.Node node = top.toNode();
			if (open.isEmpty()) {
				return node;
			}
			open.peek().children.add(node);
		}
	}

	/**
	 * A node whose children are still being derived.
	 */
	private static final class Frame {

		private final Reduction.Expand expand;
		private final List<DerivationTree> children;

		Frame(Reduction.Expand expand) {
			this.expand = expand;
			this.children = new ArrayList<>(expand.symbols().size());
		}

		boolean hasPending() {
			return children.size() < expand.symbols().size();
		}

		Symbol nextSymbol() {
			return expand.symbols().get(children.size());
		}

		DerivationTree.Node toNode() {
			return new DerivationTree.Node(expand.rule(), expand.reference(), expand.chosen(), children);
		}
	}
}
