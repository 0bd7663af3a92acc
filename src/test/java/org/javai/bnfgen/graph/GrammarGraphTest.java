package org.javai.bnfgen.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.javai.bnfgen.grammar.NonTerminal;
import org.javai.bnfgen.grammar.RawGrammar;
import org.javai.bnfgen.parse.BnfParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GrammarGraph")
class GrammarGraphTest {

	private static GrammarGraph graph(String source) {
		return GrammarGraph.of(BnfParser.parse(source));
	}

	private static NonTerminal nt(String name) {
		return NonTerminal.untyped(name);
	}

	@Nested
	@DisplayName("Edges")
	class Edges {

		@Test
		void untypedReferenceFansOutToEverySameNamedRule() {
			GrammarGraph graph = graph("""
					<S> ::= <E> ;
					<E: "int"> ::= "1" ;
					<E: "set"> ::= "{}" ;
					""");

			assertThat(graph.successors(nt("S")))
					.containsExactly(NonTerminal.typed("E", "int"), NonTerminal.typed("E", "set"));
		}

		@Test
		void typedReferenceTargetsExactRule() {
			GrammarGraph graph = graph("""
					<S> ::= <E: "set"> ;
					<E: "int"> ::= "1" ;
					<E: "set"> ::= "{}" ;
					""");

			assertThat(graph.successors(nt("S"))).containsExactly(NonTerminal.typed("E", "set"));
		}

		@Test
		void undefinedReferencesContributeNoEdges() {
			GrammarGraph graph = graph("<S> ::= <Missing> \"a\" ;");

			assertThat(graph.nodes()).containsExactly(nt("S"));
			assertThat(graph.successors(nt("S"))).isEmpty();
		}

		@Test
		void duplicateRulesMergeIntoOneNode() {
			GrammarGraph graph = graph("""
					<S> ::= <A> ;
					<S> ::= <B> ;
					<A> ::= "a" ;
					<B> ::= "b" ;
					""");

			assertThat(graph.nodes()).containsExactly(nt("S"), nt("A"), nt("B"));
			assertThat(graph.successors(nt("S"))).containsExactly(nt("A"), nt("B"));
		}
	}

	@Nested
	@DisplayName("Trap loops")
	class TrapLoops {

		@Test
		void mutualRecursionWithoutExitIsTrapped() {
			GrammarGraph graph = graph("""
					<S> ::= <A> ;
					<A> ::= <B> ;
					<B> ::= <A> ;
					""");

			assertThat(graph.trapLoops()).singleElement().satisfies(trap -> {
				assertThat(trap.component()).containsExactly(nt("A"), nt("B"));
				assertThat(trap.trapped()).containsExactly(nt("A"), nt("B"));
			});
		}

		@Test
		void terminatingAlternativeClearsTheTrap() {
			GrammarGraph graph = graph("""
					<S> ::= <A> ;
					<A> ::= <B> ;
					<B> ::= <A> | "x" ;
					""");

			assertThat(graph.trapLoops()).isEmpty();
		}

		@Test
		void selfLoopWithoutExitIsTrapped() {
			GrammarGraph graph = graph("<S> ::= \"a\" <S> ;");

			assertThat(graph.trapLoops()).singleElement()
					.satisfies(trap -> assertThat(trap.trapped()).containsExactly(nt("S")));
		}

		@Test
		void boundedLimitIsAnExit() {
			GrammarGraph graph = graph("<S> ::= \"a\" <S> {0,5} ;");

			assertThat(graph.trapLoops()).isEmpty();
		}

		@Test
		void openEndedLimitIsNoExit() {
			GrammarGraph graph = graph("<S> ::= \"a\" <S> {2,} ;");

			assertThat(graph.trapLoops()).hasSize(1);
		}

		@Test
		void exitOutsideTheComponentCounts() {
			GrammarGraph graph = graph("""
					<A> ::= <B> <Leaf> | <Leaf> ;
					<B> ::= <A> ;
					<Leaf> ::= "leaf" ;
					""");

			assertThat(graph.trapLoops()).isEmpty();
		}

		@Test
		void onlyMembersThatCannotEscapeAreReported() {
			GrammarGraph graph = graph("""
					<A> ::= <B> | "a" ;
					<B> ::= <C> <A> ;
					<C> ::= <B> ;
					""");

			// The component has an exit through "a", but B needs C, which only leads back to B.
			assertThat(graph.trapLoops()).singleElement().satisfies(trap -> {
				assertThat(trap.component()).containsExactly(nt("A"), nt("B"), nt("C"));
				assertThat(trap.trapped()).containsExactly(nt("B"), nt("C"));
			});
		}

		@Test
		void untypedReferenceEscapesThroughAnySameNamedRule() {
			GrammarGraph graph = graph("""
					<E: "a"> ::= <E> "+" ;
					<E: "b"> ::= "b" ;
					""");

			assertThat(graph.trapLoops()).isEmpty();
		}

		@Test
		void deepChainsDoNotOverflow() {
			StringBuilder source = new StringBuilder();
			int depth = 20_000;
			for (int i = 0; i < depth; i++) {
				source.append("<N").append(i).append("> ::= <N").append(i + 1).append("> ;\n");
			}
			source.append("<N").append(depth).append("> ::= <N0> ;\n");

			List<TrapLoop> traps = graph(source.toString()).trapLoops();

			assertThat(traps).singleElement()
					.satisfies(trap -> assertThat(trap.trapped()).hasSize(depth + 1));
		}
	}

	@Nested
	@DisplayName("Components")
	class Components {

		@Test
		void componentsAreReverseTopological() {
			GrammarGraph graph = graph("""
					<S> ::= <A> ;
					<A> ::= <B> | "a" ;
					<B> ::= <A> ;
					""");

			List<List<NonTerminal>> components = graph.stronglyConnectedComponents();

			assertThat(components).containsExactly(List.of(nt("A"), nt("B")), List.of(nt("S")));
		}
	}

	@Nested
	@DisplayName("Reachability")
	class Reachability {

		@Test
		void reportsRulesNotReachableFromStart() {
			GrammarGraph graph = graph("""
					<S> ::= <A> ;
					<A> ::= "a" ;
					<Orphan> ::= <Lonely> ;
					<Lonely> ::= "x" ;
					""");

			assertThat(graph.unreachableFrom(nt("S"))).containsExactly(nt("Orphan"), nt("Lonely"));
		}

		@Test
		void untypedStartBeginsAtEverySameNamedRule() {
			GrammarGraph graph = graph("""
					<S: "one"> ::= <A> ;
					<S: "two"> ::= <B> ;
					<A> ::= "a" ;
					<B> ::= "b" ;
					""");

			assertThat(graph.unreachableFrom(nt("S"))).isEmpty();
			assertThat(graph.unreachableFrom(NonTerminal.typed("S", "one")))
					.containsExactly(NonTerminal.typed("S", "two"), nt("B"));
		}

		@Test
		void undefinedStartIsRejected() {
			GrammarGraph graph = graph("<S> ::= \"a\" ;");

			assertThatThrownBy(() -> graph.unreachableFrom(nt("Nope")))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		void largeGrammarsAreTraversedIteratively() {
			List<String> lines = new ArrayList<>();
			for (int i = 0; i < 10_000; i++) {
				lines.add("<R" + i + "> ::= <R" + (i + 1) + "> | \"end\" ;");
			}
			lines.add("<R10000> ::= \"end\" ;");
			GrammarGraph graph = graph(String.join("\n", lines));

			assertThat(graph.unreachableFrom(nt("R0"))).isEmpty();
			assertThat(graph.unreachableFrom(nt("R5000"))).hasSize(5000);
		}
	}
}
