package org.javai.bnfgen.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayDeque;
import java.util.Deque;
import org.javai.bnfgen.gen.DerivationTree;
import org.javai.bnfgen.grammar.NonTerminal;

/**
 * Emits a {@link DerivationTree} as JSON.
 * <p>
 * Leaves become {@code {"text": "..."}}; nodes carry the rule name, its type tag if
 * any, the chosen alternative and their children. The tree is walked with an explicit
 * stack, so {@link #emit} handles trees of any depth; {@link #toJson} is subject to
 * Jackson's nesting limit.
 */
public final class DerivationTreeJsonEmitter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private DerivationTreeJsonEmitter() {}

	public static ObjectNode emit(DerivationTree tree) {
		ObjectNode root = shell(tree);
		Deque<Pending> pending = new ArrayDeque<>();
		if (tree instanceof DerivationTree.Node branch) {
			pending.push(new Pending(branch, (ArrayNode) root.get("children")));
		}
		while (!pending.isEmpty()) {
			Pending next = pending.pop();
			for (DerivationTree child : next.branch().children()) {
				ObjectNode json = shell(child);
				next.children().add(json);
				if (child instanceof DerivationTree.Node node) {
					pending.push(new Pending(node, (ArrayNode) json.get("children")));
				}
			}
		}
		return root;
	}

	public static String toJson(DerivationTree tree) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(emit(tree));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize derivation tree", e);
		}
	}

	// children are filled in later by emit
	private static ObjectNode shell(DerivationTree tree) {
		ObjectNode node = mapper.createObjectNode();
		if (tree instanceof DerivationTree.Leaf leaf) {
			node.put("text", leaf.text());
			return node;
		}
		DerivationTree.Node branch = (DerivationTree.Node) tree;
		putNonTerminal(node, branch.rule());
		node.put("alternative", branch.alternative().toString());
		node.putArray("children");
		return node;
	}

	private record Pending(DerivationTree.Node branch, ArrayNode children) {}

	private static void putNonTerminal(ObjectNode node, NonTerminal rule) {
		node.put("rule", rule.name());
		rule.type().ifPresent(type -> node.put("type", type));
	}
}
