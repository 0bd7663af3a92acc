package org.javai.bnfgen.grammar;

/**
 * Half-open character range {@code [start, end)} in grammar source text.
 */
public record Span(int start, int end) {

	/**
	 * Span used for elements that were built programmatically rather than parsed.
	 */
	public static final Span UNKNOWN = new Span(-1, -1);

	public Span {
		if (start != -1 || end != -1) {
			if (start < 0 || end < start) {
				throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
			}
		}
	}

	public static Span of(int start, int end) {
		return new Span(start, end);
	}

	public boolean isKnown() {
		return start >= 0;
	}

	public int length() {
		return isKnown() ? end - start : 0;
	}

	/**
	 * Smallest span covering both this span and {@code other}.
	 */
	public Span union(Span other) {
		if (!isKnown()) {
			return other;
		}
		if (!other.isKnown()) {
			return this;
		}
		return new Span(Math.min(start, other.start), Math.max(end, other.end));
	}

	@Override
	public String toString() {
		return isKnown() ? "[" + start + ".." + end + ")" : "[?]";
	}
}
