package org.javai.bnfgen.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.javai.bnfgen.gen.GeneratorSettings;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link GeneratorSettings} from YAML.
 *
 * <pre>
 * separator: " "
 * max_steps: 10000      # or "unlimited"
 * max_attempts: 100
 * </pre>
 *
 * Every key is optional and falls back to {@link GeneratorSettings#defaults()}.
 * Unknown keys are rejected so that typos do not go unnoticed.
 */
public class GeneratorSettingsLoader {

	static final String SEPARATOR = "separator";
	static final String MAX_STEPS = "max_steps";
	static final String MAX_ATTEMPTS = "max_attempts";
	static final String UNLIMITED = "unlimited";

	private static final Set<String> KEYS = Set.of(SEPARATOR, MAX_STEPS, MAX_ATTEMPTS);

	private final Yaml yaml = new Yaml();

	/**
	 * Load settings from a path.
	 */
	public GeneratorSettings load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (SettingsLoadException e) {
			throw e;
		} catch (Exception e) {
			throw new SettingsLoadException("Failed to load generator settings from path: " + path, e);
		}
	}

	/**
	 * Load settings from an input stream.
	 */
	public GeneratorSettings load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (SettingsLoadException e) {
			throw e;
		} catch (Exception e) {
			throw new SettingsLoadException("Failed to load generator settings from input stream", e);
		}
	}

	/**
	 * Load settings from a reader.
	 */
	public GeneratorSettings load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (SettingsLoadException e) {
			throw e;
		} catch (Exception e) {
			throw new SettingsLoadException("Failed to load generator settings from reader", e);
		}
	}

	/**
	 * Load settings from a string.
	 */
	public GeneratorSettings loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (SettingsLoadException e) {
			throw e;
		} catch (Exception e) {
			throw new SettingsLoadException("Failed to load generator settings from string", e);
		}
	}

	private GeneratorSettings build(Object document) {
		if (document == null) {
			return GeneratorSettings.defaults();
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new SettingsLoadException("Generator settings must be a mapping, found: " + document);
		}
		for (Object key : data.keySet()) {
			if (!KEYS.contains(String.valueOf(key))) {
				throw new SettingsLoadException("Unknown generator setting '" + key + "'; expected one of " + KEYS);
			}
		}

		GeneratorSettings.Builder builder = GeneratorSettings.builder();
		if (data.containsKey(SEPARATOR)) {
			Object separator = data.get(SEPARATOR);
			builder.separator(separator != null ? String.valueOf(separator) : "");
		}
		if (data.containsKey(MAX_STEPS)) {
			Object maxSteps = data.get(MAX_STEPS);
			if (maxSteps == null || UNLIMITED.equals(maxSteps)) {
				builder.unlimitedSteps();
			} else {
				builder.maxSteps(toLong(MAX_STEPS, maxSteps));
			}
		}
		if (data.containsKey(MAX_ATTEMPTS)) {
			builder.maxAttempts(Math.toIntExact(toLong(MAX_ATTEMPTS, data.get(MAX_ATTEMPTS))));
		}
		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new SettingsLoadException("Invalid generator settings: " + e.getMessage(), e);
		}
	}

	private long toLong(String key, Object value) {
		if (value instanceof Integer || value instanceof Long) {
			return ((Number) value).longValue();
		}
		throw new SettingsLoadException("Setting '" + key + "' must be an integer, found: " + value);
	}
}
