package org.javai.bnfgen.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.bnfgen.Bnfgen;
import org.javai.bnfgen.gen.DerivationTree;
import org.javai.bnfgen.grammar.CheckedGrammar;
import org.javai.bnfgen.grammar.NonTerminal;
import org.junit.jupiter.api.Test;

class DerivationTreeJsonEmitterTest {

	private static final CheckedGrammar GRAMMAR = Bnfgen.compile("""
			<S> ::= <E> "!" ;
			<E: "int"> ::= "1" ;
			""");

	@Test
	void emitsRulesAlternativesAndLeaves() {
		DerivationTree tree = Bnfgen.generateTree(GRAMMAR, NonTerminal.untyped("S"), 1L);

		ObjectNode json = DerivationTreeJsonEmitter.emit(tree);

		assertThat(json.get("rule").asText()).isEqualTo("S");
		assertThat(json.has("type")).isFalse();
		assertThat(json.get("alternative").asText()).isEqualTo("<E> \"!\"");
		JsonNode children = json.get("children");
		assertThat(children.size()).isEqualTo(2);
		assertThat(children.get(0).get("rule").asText()).isEqualTo("E");
		assertThat(children.get(0).get("type").asText()).isEqualTo("int");
		assertThat(children.get(0).get("children").get(0).get("text").asText()).isEqualTo("1");
		assertThat(children.get(1).get("text").asText()).isEqualTo("!");
	}

	@Test
	void leafIsAnObjectWithText() {
		ObjectNode json = DerivationTreeJsonEmitter.emit(new DerivationTree.Leaf("x"));

		assertThat(json.size()).isEqualTo(1);
		assertThat(json.get("text").asText()).isEqualTo("x");
	}

	@Test
	void toJsonIsParseable() throws Exception {
		DerivationTree tree = Bnfgen.generateTree(GRAMMAR, NonTerminal.untyped("S"), 1L);

		String text = DerivationTreeJsonEmitter.toJson(tree);

		assertThat(text).contains("\n");
		assertThat(new ObjectMapper().readTree(text)).isEqualTo(DerivationTreeJsonEmitter.emit(tree));
	}

	@Test
	void emitsVeryDeepTrees() {
		CheckedGrammar deep = Bnfgen.compile("<S> ::= \"a\" <S> {50000} | \"b\" ;");
		DerivationTree tree = Bnfgen.generateTree(deep, NonTerminal.untyped("S"), 1L);

		ObjectNode json = DerivationTreeJsonEmitter.emit(tree);

		JsonNode node = json;
		for (int i = 0; i < 50_000; i++) {
			assertThat(node.get("children").get(0).get("text").asText()).isEqualTo("a");
			node = node.get("children").get(1);
		}
		assertThat(node.get("children").get(0).get("text").asText()).isEqualTo("b");
	}
}
