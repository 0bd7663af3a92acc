package org.javai.bnfgen.validate;

import java.util.List;
import java.util.Objects;
import org.javai.bnfgen.grammar.NonTerminal;
import org.javai.bnfgen.grammar.Span;

/**
 * One validation finding.
 *
 * @param kind what was found
 * @param message human readable explanation
 * @param spans source locations involved; the first is the primary location
 * @param subjects rules the finding is about, if any
 */
public record Diagnostic(DiagnosticKind kind, String message, List<Span> spans, List<NonTerminal> subjects) {

	public Diagnostic {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(message, "message must not be null");
		spans = spans != null ? List.copyOf(spans) : List.of();
		subjects = subjects != null ? List.copyOf(subjects) : List.of();
	}

	public static Diagnostic undefinedSymbol(NonTerminal reference, Span span) {
		String message = reference.isTyped()
				? "No rule is defined for " + reference
				: "No rule named '" + reference.name() + "' is defined";
		return new Diagnostic(DiagnosticKind.UNDEFINED_SYMBOL, message, List.of(span), List.of(reference));
	}

	public static Diagnostic duplicateRule(NonTerminal rule, Span duplicate, Span previous) {
		return new Diagnostic(DiagnosticKind.DUPLICATE_RULE,
				"Rule " + rule + " is defined more than once",
				List.of(duplicate, previous), List.of(rule));
	}

	public static Diagnostic invalidLimitRange(NonTerminal rule, int min, int max, Span span) {
		return new Diagnostic(DiagnosticKind.INVALID_LIMIT_RANGE,
				"Invoke limit {" + min + "," + max + "} in " + rule + ": min should be less than or equal to max",
				List.of(span), List.of(rule));
	}

	public static Diagnostic regexCompileError(String pattern, String reason, Span span) {
		return new Diagnostic(DiagnosticKind.REGEX_COMPILE_ERROR,
				"Pattern '" + pattern + "' does not compile: " + reason,
				List.of(span), List.of());
	}

	public static Diagnostic trapLoop(List<NonTerminal> trapped, List<Span> spans) {
		return new Diagnostic(DiagnosticKind.TRAP_LOOP,
				"Rules " + trapped + " recurse into each other with no alternative that terminates",
				spans, trapped);
	}

	public static Diagnostic unreachableRule(NonTerminal rule, NonTerminal start, Span span) {
		return new Diagnostic(DiagnosticKind.UNREACHABLE_RULE,
				"Rule " + rule + " cannot be reached from " + start,
				List.of(span), List.of(rule));
	}

	public Severity severity() {
		return kind.severity();
	}

	public boolean isBlocking() {
		return kind.isBlocking();
	}

	public Span primarySpan() {
		return spans.isEmpty() ? Span.UNKNOWN : spans.get(0);
	}

	@Override
	public String toString() {
		return severity().name().toLowerCase() + ": " + kind.title() + ": " + message;
	}
}
