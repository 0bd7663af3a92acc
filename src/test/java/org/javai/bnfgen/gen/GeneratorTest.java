package org.javai.bnfgen.gen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.javai.bnfgen.Bnfgen;
import org.javai.bnfgen.grammar.CheckedGrammar;
import org.javai.bnfgen.grammar.ExhaustedProductionException;
import org.javai.bnfgen.grammar.NonTerminal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Generator")
class GeneratorTest {

	private static final NonTerminal S = NonTerminal.untyped("S");

	private static final String ARITHMETIC = """
			<S> ::= <E> ;
			<E> ::= <T> | <E> "+" <T> {0,4} | <E> "*" <T> {0,4} ;
			<T> ::= re("[1-9][0-9]?") | "(" <E> ")" {0,2} ;
			""";

	@Nested
	@DisplayName("Flat output")
	class FlatOutput {

		@Test
		void terminalsAreJoinedInLeftmostOrder() {
			CheckedGrammar grammar = Bnfgen.compile("""
					<S> ::= <A> <B> "c" ;
					<A> ::= "a1" "a2" ;
					<B> ::= "b" ;
					""");

			assertThat(new Generator(grammar).generate(S, 1L)).isEqualTo("a1 a2 b c");
		}

		@Test
		void separatorIsConfigurable() {
			CheckedGrammar grammar = Bnfgen.compile("<S> ::= \"a\" \"b\" \"c\" ;");
			Generator generator = new Generator(grammar, GeneratorSettings.builder().separator("").build());

			assertThat(generator.generate(S, 1L)).isEqualTo("abc");
		}

		@Test
		void sameSeedSameOutput() {
			Generator generator = new Generator(Bnfgen.compile(ARITHMETIC));

			for (long seed = 0; seed < 50; seed++) {
				assertThat(generator.generate(S, seed)).isEqualTo(generator.generate(S, seed));
			}
		}

		@Test
		void differentSeedsExploreTheLanguage() {
			Generator generator = new Generator(Bnfgen.compile(ARITHMETIC));
			Set<String> outputs = new HashSet<>();
			for (long seed = 0; seed < 50; seed++) {
				outputs.add(generator.generate(S, seed));
			}

			assertThat(outputs).hasSizeGreaterThan(10);
		}

		@Test
		void limitedRecursionTerminates() {
			Generator generator = new Generator(Bnfgen.compile(ARITHMETIC));

			for (long seed = 0; seed < 200; seed++) {
				String output = generator.generate(S, seed);
				long operators = output.chars().filter(c -> c == '+' || c == '*').count();
				assertThat(operators).isLessThanOrEqualTo(8);
			}
		}

		@Test
		void requiredRepetitionsAreProduced() {
			CheckedGrammar grammar = Bnfgen.compile("""
					<S> ::= <Item> <S> {3} | "end" ;
					<Item> ::= "x" ;
					""");

			for (long seed = 0; seed < 20; seed++) {
				assertThat(new Generator(grammar).generate(S, seed)).isEqualTo("x x x end");
			}
		}

		@Test
		void exhaustedProductionAbortsTheRun() {
			CheckedGrammar grammar = Bnfgen.compile("<S> ::= <A> <A> ; <A> ::= \"a\" {1} ;");
			Generator generator = new Generator(grammar);
			GenerationRun run = generator.newRun(S, 1L);

			assertThatThrownBy(() -> generator.generate(run))
					.isInstanceOfSatisfying(ExhaustedProductionException.class,
							ex -> assertThat(ex.nonTerminal()).isEqualTo(NonTerminal.untyped("A")));
			assertThat(run.status()).isEqualTo(RunStatus.FAILED);
			assertThat(run.failure()).isPresent();
		}

		@Test
		void typedStartOnlyUsesThatRule() {
			CheckedGrammar grammar = Bnfgen.compile("""
					<E: "int"> ::= "1" | "2" ;
					<E: "bool"> ::= "true" | "false" ;
					""");
			Generator generator = new Generator(grammar);

			for (long seed = 0; seed < 50; seed++) {
				assertThat(generator.generate(NonTerminal.typed("E", "bool"), seed)).isIn("true", "false");
			}
		}
	}

	@Nested
	@DisplayName("Run lifecycle")
	class RunLifecycle {

		private final Generator generator = new Generator(Bnfgen.compile("<S> ::= \"a\" \"b\" ;"));

		@Test
		void runMovesFromIdleToDone() {
			GenerationRun run = generator.newRun(S, 1L);
			assertThat(run.status()).isEqualTo(RunStatus.IDLE);

			generator.generate(run);

			assertThat(run.status()).isEqualTo(RunStatus.DONE);
			assertThat(run.steps()).isEqualTo(3);
			assertThat(run.failure()).isEmpty();
		}

		@Test
		void runExecutesOnce() {
			GenerationRun run = generator.newRun(S, 1L);
			generator.generate(run);

			assertThatThrownBy(() -> generator.generate(run))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("DONE");
		}

		@Test
		void undefinedStartIsRejected() {
			assertThatThrownBy(() -> generator.generate(NonTerminal.untyped("Nope"), 1L))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("<Nope>");
		}
	}

	@Nested
	@DisplayName("Step ceiling")
	class StepCeiling {

		private static final String UNBOUNDED = "<S> ::= \"a\" <S> | \"a\" ;";

		@Test
		void runOverTheCeilingFails() {
			CheckedGrammar grammar = Bnfgen.compile("<S> ::= \"a\" <S> {10} | \"end\" ;");
			Generator generator = new Generator(grammar, GeneratorSettings.builder().maxSteps(5).build());
			GenerationRun run = generator.newRun(S, 1L);

			assertThatThrownBy(() -> generator.generate(run))
					.isInstanceOfSatisfying(StepLimitExceededException.class,
							ex -> assertThat(ex.maxSteps()).isEqualTo(5));
			assertThat(run.status()).isEqualTo(RunStatus.FAILED);
			assertThat(run.steps()).isEqualTo(5);
		}

		@Test
		void batchRetriesRunsThatHitTheCeiling() {
			Generator generator = new Generator(Bnfgen.compile(UNBOUNDED),
					GeneratorSettings.builder().maxSteps(12).maxAttempts(1_000).build());

			List<String> outputs = generator.generateMany(S, 25, 7L);

			assertThat(outputs).hasSize(25);
			assertThat(outputs).allSatisfy(out -> assertThat(out.split(" ")).hasSizeLessThanOrEqualTo(6));
		}

		@Test
		void batchGivesUpAfterMaxAttempts() {
			CheckedGrammar grammar = Bnfgen.compile("<S> ::= \"a\" <S> {10} | \"end\" ;");
			Generator generator = new Generator(grammar, GeneratorSettings.builder().maxSteps(5).maxAttempts(3).build());

			assertThatThrownBy(() -> generator.generateMany(S, 1, 1L))
					.isInstanceOf(StepLimitExceededException.class);
		}

		@Test
		void batchIsReproducible() {
			Generator generator = new Generator(Bnfgen.compile(ARITHMETIC));

			assertThat(generator.generateMany(S, 10, 99L)).isEqualTo(generator.generateMany(S, 10, 99L));
		}

		@Test
		void batchOfZeroIsEmpty() {
			Generator generator = new Generator(Bnfgen.compile(UNBOUNDED));

			assertThat(generator.generateMany(S, 0, 1L)).isEmpty();
		}
	}

	@Nested
	@DisplayName("Concurrency")
	class Concurrency {

		@Test
		void sharedGrammarGivesSameResultsOnAnyThread() throws Exception {
			Generator generator = new Generator(Bnfgen.compile(ARITHMETIC));
			List<String> expected = new ArrayList<>();
			for (long seed = 0; seed < 64; seed++) {
				expected.add(generator.generate(S, seed));
			}

			ExecutorService pool = Executors.newFixedThreadPool(8);
			try {
				List<Future<String>> futures = new ArrayList<>();
				for (long seed = 0; seed < 64; seed++) {
					long s = seed;
					futures.add(pool.submit(() -> generator.generate(S, s)));
				}
				for (int i = 0; i < futures.size(); i++) {
					assertThat(futures.get(i).get(10, TimeUnit.SECONDS)).isEqualTo(expected.get(i));
				}
			}
			finally {
				pool.shutdownNow();
			}
		}
	}
}
