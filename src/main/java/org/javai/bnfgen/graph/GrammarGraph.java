package org.javai.bnfgen.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.bnfgen.grammar.Alternative;
import org.javai.bnfgen.grammar.NonTerminal;
import org.javai.bnfgen.grammar.RawGrammar;
import org.javai.bnfgen.grammar.Rule;
import org.javai.bnfgen.grammar.Symbol;

/**
 * Directed graph over rule identities with an edge {@code A -> B} whenever an
 * alternative of {@code A} references {@code B}. An untyped reference has an edge to
 * every rule of that name.
 * <p>
 * Built from a {@link RawGrammar}, so it tolerates undefined references (they simply
 * contribute no edges) and duplicate rules (merged into one node).
 */
public final class GrammarGraph {

	private final List<NonTerminal> nodes;
	private final Map<NonTerminal, Integer> index;
	private final List<List<Alternative>> alternatives;
	private final List<Set<Integer>> edges;
	private final Map<String, List<Integer>> nodesByName;

	private GrammarGraph(List<NonTerminal> nodes, Map<NonTerminal, Integer> index,
						 List<List<Alternative>> alternatives, List<Set<Integer>> edges,
						 Map<String, List<Integer>> nodesByName) {
		this.nodes = nodes;
		this.index = index;
		this.alternatives = alternatives;
		this.edges = edges;
		this.nodesByName = nodesByName;
	}

	public static GrammarGraph of(RawGrammar grammar) {
		Objects.requireNonNull(grammar, "grammar must not be null");
		List<NonTerminal> nodes = new ArrayList<>();
		Map<NonTerminal, Integer> index = new LinkedHashMap<>();
		List<List<Alternative>> alternatives = new ArrayList<>();
		Map<String, List<Integer>> byName = new LinkedHashMap<>();
		for (Rule rule : grammar.rules()) {
			Integer node = index.get(rule.lhs());
			if (node == null) {
				node = nodes.size();
				nodes.add(rule.lhs());
				index.put(rule.lhs(), node);
				alternatives.add(new ArrayList<>());
				byName.computeIfAbsent(rule.lhs().name(), k -> new ArrayList<>()).add(node);
			}
			alternatives.get(node).addAll(rule.alternatives());
		}

		GrammarGraph graph = new GrammarGraph(List.copyOf(nodes), index, alternatives, new ArrayList<>(), byName);
		for (int node = 0; node < nodes.size(); node++) {
			Set<Integer> targets = new LinkedHashSet<>();
			for (Alternative alternative : alternatives.get(node)) {
				alternative.references().forEach(ref -> targets.addAll(graph.targets(ref)));
			}
			graph.edges.add(targets);
		}
		return graph;
	}

	public List<NonTerminal> nodes() {
		return nodes;
	}

	/**
	 * Rule identities {@code from} has a direct edge to.
	 */
	public List<NonTerminal> successors(NonTerminal from) {
		Integer node = index.get(from);
		if (node == null) {
			return List.of();
		}
		return edges.get(node).stream().map(nodes::get).toList();
	}

	/**
	 * Nodes a reference may resolve to.
	 */
	private List<Integer> targets(NonTerminal reference) {
		if (reference.isTyped()) {
			Integer node = index.get(reference);
			return node != null ? List.of(node) : List.of();
		}
		return nodesByName.getOrDefault(reference.name(), List.of());
	}

	/**
	 * Rules that cannot be reached from {@code start}, in declaration order. An untyped
	 * start begins at every rule of that name.
	 *
	 * @throws IllegalArgumentException if no rule matches {@code start}
	 */
	public List<NonTerminal> unreachableFrom(NonTerminal start) {
		Objects.requireNonNull(start, "start must not be null");
		List<Integer> roots = targets(start);
		if (roots.isEmpty()) {
			throw new IllegalArgumentException("Start symbol " + start + " is not defined");
		}
		BitSet visited = new BitSet(nodes.size());
		Deque<Integer> stack = new ArrayDeque<>(roots);
		while (!stack.isEmpty()) {
			int node = stack.pop();
			if (visited.get(node)) {
				continue;
			}
			visited.set(node);
			for (int next : edges.get(node)) {
				if (!visited.get(next)) {
					stack.push(next);
				}
			}
		}
		List<NonTerminal> unreachable = new ArrayList<>();
		for (int node = 0; node < nodes.size(); node++) {
			if (!visited.get(node)) {
				unreachable.add(nodes.get(node));
			}
		}
		return unreachable;
	}

	/**
	 * Strongly connected components in reverse topological order (Tarjan), each listed
	 * in declaration order.
	 */
	public List<List<NonTerminal>> stronglyConnectedComponents() {
		List<List<NonTerminal>> result = new ArrayList<>();
		for (List<Integer> component : tarjan()) {
			result.add(component.stream().map(nodes::get).toList());
		}
		return result;
	}

	/**
	 * Cycles that contain rules unable to terminate.
	 * <p>
	 * Within each non-trivial component, a rule can escape if one of its alternatives
	 * can: the alternative is capped by a bounded invoke limit, or each of its symbols is
	 * a terminal or a reference with at least one target outside the component or
	 * already known to escape. Rules left over after the fixpoint are trapped.
	 * <p>
	 * This is stricter than asking whether the component as a whole has an exit: a
	 * member whose only way out runs through another trapped member is reported too.
	 */
	public List<TrapLoop> trapLoops() {
		List<TrapLoop> traps = new ArrayList<>();
		for (List<Integer> component : tarjan()) {
			if (!isCycle(component)) {
				continue;
			}
			Set<Integer> members = new LinkedHashSet<>(component);
			BitSet escaping = escapingMembers(members);
			List<NonTerminal> trapped = new ArrayList<>();
			for (int node : component) {
				if (!escaping.get(node)) {
					trapped.add(nodes.get(node));
				}
			}
			if (!trapped.isEmpty()) {
				traps.add(new TrapLoop(component.stream().map(nodes::get).toList(), trapped));
			}
		}
		return traps;
	}

	private boolean isCycle(List<Integer> component) {
		if (component.size() > 1) {
			return true;
		}
		int node = component.get(0);
		return edges.get(node).contains(node);
	}

	private BitSet escapingMembers(Set<Integer> members) {
		BitSet escaping = new BitSet(nodes.size());
		boolean changed = true;
		while (changed) {
			changed = false;
			for (int node : members) {
				if (escaping.get(node)) {
					continue;
				}
				for (Alternative alternative : alternatives.get(node)) {
					if (canEscape(alternative, members, escaping)) {
						escaping.set(node);
						changed = true;
						break;
					}
				}
			}
		}
		return escaping;
	}

	private boolean canEscape(Alternative alternative, Set<Integer> members, BitSet escaping) {
		if (alternative.invokeLimit().isBounded()) {
			return true;
		}
		for (Symbol symbol : alternative.symbols()) {
			if (!(symbol instanceof Symbol.NonTerminalRef ref)) {
				continue;
			}
			List<Integer> targets = targets(ref.target());
			if (targets.isEmpty()) {
				continue;
			}
			boolean exit = false;
			for (int target : targets) {
				if (!members.contains(target) || escaping.get(target)) {
					exit = true;
					break;
				}
			}
			if (!exit) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Iterative Tarjan so deep grammars cannot overflow the call stack.
	 */
	private List<List<Integer>> tarjan() {
		int size = nodes.size();
		int[] order = new int[size];
		int[] low = new int[size];
		Arrays.fill(order, -1);
		BitSet onStack = new BitSet(size);
		Deque<Integer> componentStack = new ArrayDeque<>();
		List<List<Integer>> components = new ArrayList<>();
		int[][] adjacency = new int[size][];
		for (int node = 0; node < size; node++) {
			adjacency[node] = edges.get(node).stream().mapToInt(Integer::intValue).toArray();
		}
		int counter = 0;

		for (int root = 0; root < size; root++) {
			if (order[root] != -1) {
				continue;
			}
			Deque<int[]> work = new ArrayDeque<>();
			work.push(new int[] { root, 0 });
			while (!work.isEmpty()) {
				int[] frame = work.peek();
				int node = frame[0];
				if (frame[1] == 0 && order[node] == -1) {
					order[node] = counter;
					low[node] = counter;
					counter++;
					componentStack.push(node);
					onStack.set(node);
				}
				int[] successors = adjacency[node];
				if (frame[1] < successors.length) {
					int next = successors[frame[1]++];
					if (order[next] == -1) {
						work.push(new int[] { next, 0 });
					} else if (onStack.get(next)) {
						low[node] = Math.min(low[node], order[next]);
					}
					continue;
				}
				work.pop();
				if (!work.isEmpty()) {
					int parent = work.peek()[0];
					low[parent] = Math.min(low[parent], low[node]);
				}
				if (low[node] == order[node]) {
					List<Integer> component = new ArrayList<>();
					int member;
					do {
						member = componentStack.pop();
						onStack.clear(member);
						component.add(member);
					} while (member != node);
					component.sort(Integer::compare);
					components.add(component);
				}
			}
		}
		return components;
	}
}
