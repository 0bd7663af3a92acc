package org.javai.bnfgen.grammar;

import java.util.Objects;
import java.util.Optional;

/**
 * Identity of a rule: a name plus an optional type tag.
 * <p>
 * Two rules may share a name as long as their type tags differ, e.g.
 * {@code <E: "int">} and {@code <E: "set">}. An untyped reference to {@code <E>}
 * resolves to every rule named {@code E}; a typed reference needs an exact match.
 */
public record NonTerminal(String name, String typeTag) {

	public NonTerminal {
		Objects.requireNonNull(name, "name must not be null");
		if (name.isBlank()) {
			throw new IllegalArgumentException("Non-terminal name must not be blank");
		}
	}

	public static NonTerminal untyped(String name) {
		return new NonTerminal(name, null);
	}

	public static NonTerminal typed(String name, String typeTag) {
		Objects.requireNonNull(typeTag, "typeTag must not be null");
		return new NonTerminal(name, typeTag);
	}

	public Optional<String> type() {
		return Optional.ofNullable(typeTag);
	}

	public boolean isTyped() {
		return typeTag != null;
	}

	/**
	 * Whether a reference to this non-terminal may resolve to a rule with the given identity.
	 */
	public boolean matches(NonTerminal ruleIdentity) {
		if (!name.equals(ruleIdentity.name)) {
			return false;
		}
		return !isTyped() || typeTag.equals(ruleIdentity.typeTag);
	}

	@Override
	public String toString() {
		return isTyped() ? "<" + name + ": \"" + typeTag + "\">" : "<" + name + ">";
	}
}
