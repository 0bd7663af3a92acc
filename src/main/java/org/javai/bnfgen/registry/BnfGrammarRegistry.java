package org.javai.bnfgen.registry;

import java.io.IOException;
import java.io.InputStream;
import java.net.JarURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;
import org.javai.bnfgen.grammar.CheckedGrammar;
import org.javai.bnfgen.grammar.RawGrammar;
import org.javai.bnfgen.parse.BnfParseException;
import org.javai.bnfgen.parse.BnfParser;
import org.javai.bnfgen.validate.GrammarValidationException;
import org.javai.bnfgen.validate.GrammarValidator;
import org.javai.bnfgen.validate.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry for compiled grammars.
 *
 * Applications can use this to compile grammar sources once and access them by id.
 * Registrations are idempotent per id: the first grammar registered under an id wins.
 * <p>
 * Grammars found on the classpath follow the naming convention
 * {@code META-INF/bnfgen-grammar-<id>.bnf}.
 */
public final class BnfGrammarRegistry {

	private static final Logger logger = LoggerFactory.getLogger(BnfGrammarRegistry.class);

	static final String META_INF_PREFIX = "bnfgen-grammar-";
	static final String EXTENSION = ".bnf";

	private final Map<String, RegisteredGrammar> grammars = new LinkedHashMap<>();
	private final GrammarValidator validator;

	private BnfGrammarRegistry(GrammarValidator validator) {
		this.validator = validator;
	}

	/**
	 * Create an empty registry backed by a fresh validator.
	 */
	public static BnfGrammarRegistry create() {
		return new BnfGrammarRegistry(new GrammarValidator());
	}

	/**
	 * Parse, validate and register grammar source text. If a grammar with the same id
	 * is already present, the existing one is kept and returned.
	 *
	 * @throws BnfParseException if the source does not parse
	 * @throws GrammarValidationException if validation finds errors
	 */
	public RegisteredGrammar register(String id, String source) {
		Objects.requireNonNull(source, "source must not be null");
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Grammar id must not be blank");
		}
		RegisteredGrammar existing = grammars.get(id);
		if (existing != null) {
			logger.debug("Grammar with id '{}' already registered; skipping", id);
			return existing;
		}
		RawGrammar raw = BnfParser.parse(source);
		ValidationResult result = validator.validate(raw);
		CheckedGrammar checked = result.requireGrammar();
		RegisteredGrammar registered = new RegisteredGrammar(id, source, checked, result.diagnostics());
		grammars.put(id, registered);
		logger.debug("Registered grammar '{}' with {} rule(s)", id, checked.rules().size());
		return registered;
	}

	/**
	 * Discover and register grammars found under META-INF on the classpath.
	 * <p>
	 * This scans both exploded directories and JARs for files named
	 * {@code bnfgen-grammar-*.bnf}. Grammars that fail to load are logged and skipped.
	 */
	public BnfGrammarRegistry registerMetaInfGrammars(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		try {
			Enumeration<URL> resources = loader.getResources("META-INF/");
			while (resources.hasMoreElements()) {
				URL url = resources.nextElement();
				if ("file".equalsIgnoreCase(url.getProtocol())) {
					loadFromDirectory(url);
				}
				else if ("jar".equalsIgnoreCase(url.getProtocol())) {
					loadFromJar(url);
				}
			}
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to scan META-INF for grammars", e);
		}
		return this;
	}

	/**
	 * Load a grammar from a classpath resource using this class' loader.
	 */
	public RegisteredGrammar registerResource(String resourcePath) {
		return registerResource(resourcePath, BnfGrammarRegistry.class.getClassLoader());
	}

	/**
	 * Load and register a grammar from a classpath resource. The id is the file name
	 * without directory, {@code bnfgen-grammar-} prefix and {@code .bnf} extension.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws IllegalStateException if the resource cannot be read
	 */
	public RegisteredGrammar registerResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return register(idOf(resourcePath), new String(is.readAllBytes(), StandardCharsets.UTF_8));
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to load grammar from resource: " + resourcePath, e);
		}
	}

	/**
	 * Load and register a grammar from a filesystem path.
	 *
	 * @throws IllegalStateException if the file cannot be read
	 */
	public RegisteredGrammar registerPath(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try {
			return register(idOf(path.getFileName().toString()), Files.readString(path));
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to load grammar from path: " + path, e);
		}
	}

	/**
	 * Retrieve a grammar by id.
	 */
	public Optional<RegisteredGrammar> grammarFor(String id) {
		return Optional.ofNullable(grammars.get(id));
	}

	/**
	 * Retrieve a checked grammar by id or throw if not present.
	 */
	public CheckedGrammar requireGrammar(String id) {
		return grammarFor(id)
				.map(RegisteredGrammar::grammar)
				.orElseThrow(() -> new IllegalStateException("No grammar registered for id: " + id));
	}

	/**
	 * All registered grammars in insertion order.
	 */
	public List<RegisteredGrammar> grammars() {
		return List.copyOf(grammars.values());
	}

	static String idOf(String resourcePath) {
		String name = resourcePath.substring(resourcePath.lastIndexOf('/') + 1);
		if (name.startsWith(META_INF_PREFIX)) {
			name = name.substring(META_INF_PREFIX.length());
		}
		if (name.endsWith(EXTENSION)) {
			name = name.substring(0, name.length() - EXTENSION.length());
		}
		return name;
	}

	private static boolean isDiscoverable(String fileName) {
		return fileName.startsWith(META_INF_PREFIX) && fileName.endsWith(EXTENSION);
	}

	private void loadFromDirectory(URL url) {
		try {
			Path path = Paths.get(url.toURI());
			if (!Files.isDirectory(path)) {
				return;
			}
			try (Stream<Path> files = Files.list(path)) {
				files.filter(Files::isRegularFile)
						.filter(p -> isDiscoverable(p.getFileName().toString()))
						.sorted()
						.forEach(p -> {
							try {
								registerPath(p);
							}
							catch (RuntimeException ex) {
								logger.warn("Failed to load grammar from {}", p, ex);
							}
						});
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan directory {}", url, e);
		}
	}

	private void loadFromJar(URL url) {
		try {
			JarURLConnection conn = (JarURLConnection) url.openConnection();
			conn.setUseCaches(false);
			try (JarFile jar = conn.getJarFile()) {
				Enumeration<JarEntry> entries = jar.entries();
				while (entries.hasMoreElements()) {
					JarEntry entry = entries.nextElement();
					if (entry.isDirectory()) {
						continue;
					}
					String name = entry.getName();
					if (!name.startsWith("META-INF/") || !isDiscoverable(name.substring(name.lastIndexOf('/') + 1))) {
						continue;
					}
					try (InputStream is = jar.getInputStream(entry)) {
						register(idOf(name), new String(is.readAllBytes(), StandardCharsets.UTF_8));
					}
					catch (IOException | RuntimeException ex) {
						logger.warn("Failed to load grammar from JAR entry {}", name, ex);
					}
				}
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan JAR {}", url, e);
		}
	}
}
