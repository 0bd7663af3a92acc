package org.javai.bnfgen.validate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * All findings of one validation pass, in the order they were found.
 */
public final class DiagnosticSet implements Iterable<Diagnostic> {

	private final List<Diagnostic> diagnostics;

	private DiagnosticSet(List<Diagnostic> diagnostics) {
		this.diagnostics = List.copyOf(diagnostics);
	}

	public static DiagnosticSet of(List<Diagnostic> diagnostics) {
		return new DiagnosticSet(diagnostics);
	}

	public static DiagnosticSet empty() {
		return new DiagnosticSet(List.of());
	}

	public List<Diagnostic> all() {
		return diagnostics;
	}

	public List<Diagnostic> errors() {
		return diagnostics.stream().filter(Diagnostic::isBlocking).toList();
	}

	public List<Diagnostic> warnings() {
		return diagnostics.stream().filter(d -> !d.isBlocking()).toList();
	}

	public List<Diagnostic> ofKind(DiagnosticKind kind) {
		return diagnostics.stream().filter(d -> d.kind() == kind).toList();
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isBlocking);
	}

	public boolean isEmpty() {
		return diagnostics.isEmpty();
	}

	public int size() {
		return diagnostics.size();
	}

	public Stream<Diagnostic> stream() {
		return diagnostics.stream();
	}

	/**
	 * A set holding the diagnostics of both sets.
	 */
	public DiagnosticSet merge(DiagnosticSet other) {
		List<Diagnostic> merged = new ArrayList<>(diagnostics);
		merged.addAll(other.diagnostics);
		return new DiagnosticSet(merged);
	}

	@Override
	public Iterator<Diagnostic> iterator() {
		return diagnostics.iterator();
	}

	@Override
	public String toString() {
		return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
	}
}
