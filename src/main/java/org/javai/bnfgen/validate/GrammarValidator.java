package org.javai.bnfgen.validate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.bnfgen.grammar.Alternative;
import org.javai.bnfgen.grammar.CheckedGrammar;
import org.javai.bnfgen.grammar.InvokeLimit;
import org.javai.bnfgen.grammar.NonTerminal;
import org.javai.bnfgen.grammar.RawGrammar;
import org.javai.bnfgen.grammar.Rule;
import org.javai.bnfgen.grammar.Span;
import org.javai.bnfgen.grammar.Symbol;
import org.javai.bnfgen.graph.GrammarGraph;
import org.javai.bnfgen.graph.TrapLoop;
import org.javai.bnfgen.regex.RegexCompileException;
import org.javai.bnfgen.regex.RegexSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static checks that turn a {@link RawGrammar} into a {@link CheckedGrammar}.
 * <p>
 * Every check runs to completion, so one pass reports all problems of a grammar.
 * Errors prevent the conversion; warnings (trap loops, unreachable rules) are logged
 * and returned alongside the checked grammar.
 * <p>
 * The validator is stateless and thread-safe.
 */
public final class GrammarValidator {

	private static final Logger logger = LoggerFactory.getLogger(GrammarValidator.class);

	/**
	 * Validate without a start symbol. Reachability is not checked.
	 */
	public ValidationResult validate(RawGrammar grammar) {
		Objects.requireNonNull(grammar, "grammar must not be null");
		return run(grammar, null);
	}

	/**
	 * Validate and additionally report rules that cannot be reached from {@code start}.
	 * An undefined start is reported as an undefined symbol.
	 */
	public ValidationResult validateWithStart(RawGrammar grammar, NonTerminal start) {
		Objects.requireNonNull(grammar, "grammar must not be null");
		Objects.requireNonNull(start, "start must not be null");
		return run(grammar, start);
	}

	private ValidationResult run(RawGrammar grammar, NonTerminal start) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		Map<NonTerminal, Rule> firstRules = new LinkedHashMap<>();
		Set<String> names = new HashSet<>();

		checkDuplicates(grammar, firstRules, names, diagnostics);
		checkReferences(grammar, firstRules, names, diagnostics);
		checkLimits(grammar, diagnostics);
		Map<String, RegexSynthesizer> patterns = compilePatterns(grammar, diagnostics);

		GrammarGraph graph = GrammarGraph.of(grammar);
		checkTrapLoops(graph, firstRules, diagnostics);
		if (start != null) {
			checkReachability(graph, start, firstRules, names, diagnostics);
		}

		DiagnosticSet result = DiagnosticSet.of(diagnostics);
		result.warnings().forEach(warning -> logger.warn("{}", warning));
		if (result.hasErrors()) {
			logger.debug("Grammar with {} rule(s) rejected with {} error(s)", grammar.rules().size(), result.errors().size());
			return ValidationResult.failure(result);
		}
		CheckedGrammar checked = CheckedGrammar.of(List.copyOf(firstRules.values()), patterns);
		logger.debug("Grammar with {} rule(s) validated with {} warning(s)", firstRules.size(), result.warnings().size());
		return ValidationResult.success(checked, result);
	}

	private static void checkDuplicates(RawGrammar grammar, Map<NonTerminal, Rule> firstRules, Set<String> names,
										List<Diagnostic> diagnostics) {
		for (Rule rule : grammar.rules()) {
			Rule previous = firstRules.putIfAbsent(rule.lhs(), rule);
			if (previous != null) {
				diagnostics.add(Diagnostic.duplicateRule(rule.lhs(), rule.span(), previous.span()));
			}
			names.add(rule.lhs().name());
		}
	}

	private static void checkReferences(RawGrammar grammar, Map<NonTerminal, Rule> firstRules, Set<String> names,
										List<Diagnostic> diagnostics) {
		grammar.symbols()
				.filter(Symbol.NonTerminalRef.class::isInstance)
				.map(Symbol.NonTerminalRef.class::cast)
				.filter(ref -> !isDefined(ref.target(), firstRules, names))
				.forEach(ref -> diagnostics.add(Diagnostic.undefinedSymbol(ref.target(), ref.span())));
	}

	private static boolean isDefined(NonTerminal reference, Map<NonTerminal, Rule> firstRules, Set<String> names) {
		return reference.isTyped() ? firstRules.containsKey(reference) : names.contains(reference.name());
	}

	private static void checkLimits(RawGrammar grammar, List<Diagnostic> diagnostics) {
		for (Rule rule : grammar.rules()) {
			for (Alternative alternative : rule.alternatives()) {
				if (alternative.invokeLimit() instanceof InvokeLimit.Limited limited && !limited.isValidRange()) {
					diagnostics.add(Diagnostic.invalidLimitRange(rule.lhs(), limited.min(), limited.max(), alternative.span()));
				}
			}
		}
	}

	private static Map<String, RegexSynthesizer> compilePatterns(RawGrammar grammar, List<Diagnostic> diagnostics) {
		Map<String, RegexSynthesizer> compiled = new HashMap<>();
		Map<String, RegexCompileException> failed = new HashMap<>();
		grammar.symbols()
				.filter(Symbol.Regex.class::isInstance)
				.map(Symbol.Regex.class::cast)
				.forEach(regex -> {
					String pattern = regex.pattern();
					if (!compiled.containsKey(pattern) && !failed.containsKey(pattern)) {
						try {
							compiled.put(pattern, RegexSynthesizer.compile(pattern));
						} catch (RegexCompileException ex) {
							failed.put(pattern, ex);
						}
					}
					RegexCompileException failure = failed.get(pattern);
					if (failure != null) {
						diagnostics.add(Diagnostic.regexCompileError(pattern,
								failure.reason() + " at index " + failure.index(), regex.span()));
					}
				});
		return compiled;
	}

	private static void checkTrapLoops(GrammarGraph graph, Map<NonTerminal, Rule> firstRules,
									   List<Diagnostic> diagnostics) {
		for (TrapLoop trap : graph.trapLoops()) {
			List<Span> spans = trap.trapped().stream().map(nt -> spanOf(nt, firstRules)).toList();
			diagnostics.add(Diagnostic.trapLoop(trap.trapped(), spans));
		}
	}

	private static void checkReachability(GrammarGraph graph, NonTerminal start, Map<NonTerminal, Rule> firstRules,
										  Set<String> names, List<Diagnostic> diagnostics) {
		if (!isDefined(start, firstRules, names)) {
			diagnostics.add(Diagnostic.undefinedSymbol(start, Span.UNKNOWN));
			return;
		}
		for (NonTerminal rule : graph.unreachableFrom(start)) {
			diagnostics.add(Diagnostic.unreachableRule(rule, start, spanOf(rule, firstRules)));
		}
	}

	private static Span spanOf(NonTerminal identity, Map<NonTerminal, Rule> firstRules) {
		Rule rule = firstRules.get(identity);
		return rule != null ? rule.span() : Span.UNKNOWN;
	}
}
