package org.javai.bnfgen.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.logging.log4j.Level;
import org.javai.bnfgen.gen.Generator;
import org.javai.bnfgen.grammar.NonTerminal;
import org.javai.bnfgen.parse.BnfParseException;
import org.javai.bnfgen.testsupport.LogCaptorAppender;
import org.javai.bnfgen.validate.GrammarValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BnfGrammarRegistryTest {

	@Test
	void shouldLoadGrammarFromResource() {
		BnfGrammarRegistry registry = BnfGrammarRegistry.create();
		RegisteredGrammar grammar = registry.registerResource("grammars/typed.bnf", getClass().getClassLoader());

		assertThat(grammar.id()).isEqualTo("typed");
		assertThat(grammar.grammar().defines(NonTerminal.typed("E", "bool"))).isTrue();
		assertThat(registry.grammarFor("typed")).contains(grammar);
	}

	@Test
	void shouldDeduplicateById() {
		BnfGrammarRegistry registry = BnfGrammarRegistry.create();
		RegisteredGrammar first = registry.registerResource("grammars/typed.bnf", getClass().getClassLoader());
		RegisteredGrammar second = registry.register("typed", "<Other> ::= \"x\" ;");

		assertThat(second).isSameAs(first);
		assertThat(registry.grammars()).hasSize(1);
	}

	@Test
	void shouldDiscoverMetaInfGrammars() {
		BnfGrammarRegistry registry = BnfGrammarRegistry.create()
				.registerMetaInfGrammars(getClass().getClassLoader());

		assertThat(registry.grammars())
				.extracting(RegisteredGrammar::id)
				.contains("arith", "greeting")
				.doesNotContain("broken");
	}

	@Test
	void shouldLogAndSkipInvalidMetaInfGrammars() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(BnfGrammarRegistry.class, Level.WARN)) {
			BnfGrammarRegistry.create().registerMetaInfGrammars(getClass().getClassLoader());

			assertThat(appender.warnings()).anyMatch(msg -> msg.contains("bnfgen-grammar-broken.bnf"));
		}
	}

	@Test
	void discoveredGrammarsAreReadyToGenerate() {
		BnfGrammarRegistry registry = BnfGrammarRegistry.create()
				.registerMetaInfGrammars(getClass().getClassLoader());
		Generator generator = new Generator(registry.requireGrammar("greeting"));

		String greeting = generator.generate("Greeting", 3L);

		assertThat(greeting.split(" ")).hasSize(2);
		assertThat(greeting).matches("(hello|hi|hey) (world|there|[A-Z][a-z]{2,6})");
	}

	@Test
	void shouldRegisterFromPath() throws Exception {
		BnfGrammarRegistry registry = BnfGrammarRegistry.create();
		URL resource = Objects.requireNonNull(getClass().getClassLoader().getResource("META-INF/bnfgen-grammar-arith.bnf"));
		Path path = Path.of(resource.toURI());

		RegisteredGrammar grammar = registry.registerPath(path);

		assertThat(grammar.id()).isEqualTo("arith");
		assertThat(grammar.source()).contains("<Expr>");
		assertThat(registry.requireGrammar("arith")).isSameAs(grammar.grammar());
	}

	@Test
	void shouldRegisterFileOutsideTheClasspath(@TempDir Path dir) throws Exception {
		Path file = Files.writeString(dir.resolve("local.bnf"), "<S> ::= \"a\" <S> ;");
		BnfGrammarRegistry registry = BnfGrammarRegistry.create();

		RegisteredGrammar grammar = registry.registerPath(file);

		assertThat(grammar.id()).isEqualTo("local");
		assertThat(grammar.diagnostics().warnings()).hasSize(1);
	}

	@Test
	void shouldRejectInvalidSource() {
		BnfGrammarRegistry registry = BnfGrammarRegistry.create();

		assertThatThrownBy(() -> registry.register("bad", "<S> ::= <Missing> ;"))
				.isInstanceOf(GrammarValidationException.class);
		assertThatThrownBy(() -> registry.register("bad", "<S> ::= "))
				.isInstanceOf(BnfParseException.class);
		assertThat(registry.grammarFor("bad")).isEmpty();
	}

	@Test
	void shouldFailWhenResourceIsMissing() {
		BnfGrammarRegistry registry = BnfGrammarRegistry.create();

		assertThatThrownBy(() -> registry.registerResource("does-not-exist.bnf", getClass().getClassLoader()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void shouldFailWhenIdIsUnknown() {
		BnfGrammarRegistry registry = BnfGrammarRegistry.create();

		assertThatThrownBy(() -> registry.requireGrammar("nope"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("nope");
	}

	@Test
	void idStripsDirectoryPrefixAndExtension() {
		assertThat(BnfGrammarRegistry.idOf("META-INF/bnfgen-grammar-sql.bnf")).isEqualTo("sql");
		assertThat(BnfGrammarRegistry.idOf("grammars/json.bnf")).isEqualTo("json");
		assertThat(BnfGrammarRegistry.idOf("plain")).isEqualTo("plain");
	}
}
