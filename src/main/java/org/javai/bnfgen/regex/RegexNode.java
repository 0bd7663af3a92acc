package org.javai.bnfgen.regex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Syntax tree of a compiled pattern, restricted to what generation needs.
 * Capturing groups are flattened and anchors compile to {@link Empty}.
 */
public sealed interface RegexNode {

	Empty EMPTY = new Empty();

	/**
	 * Matches only the empty string.
	 */
	record Empty() implements RegexNode {
	}

	record Literal(String text) implements RegexNode {
		public Literal {
			Objects.requireNonNull(text, "text must not be null");
		}
	}

	record Concat(List<RegexNode> parts) implements RegexNode {
		public Concat {
			parts = List.copyOf(parts);
		}
	}

	record Alternation(List<RegexNode> branches) implements RegexNode {
		public Alternation {
			branches = List.copyOf(branches);
			if (branches.isEmpty()) {
				throw new IllegalArgumentException("Alternation needs at least one branch");
			}
		}
	}

	/**
	 * Repetition of {@code body}; {@code max == UNBOUNDED} for {@code *}, {@code +} and {@code {n,}}.
	 */
	record Repeat(RegexNode body, int min, int max) implements RegexNode {

		public static final int UNBOUNDED = -1;

		public Repeat {
			Objects.requireNonNull(body, "body must not be null");
			if (min < 0 || (max != UNBOUNDED && max < min)) {
				throw new IllegalArgumentException("Invalid repetition {" + min + "," + max + "}");
			}
		}

		public boolean isUnbounded() {
			return max == UNBOUNDED;
		}
	}

	/**
	 * Set of characters, kept as sorted, non-overlapping inclusive ranges.
	 */
	record CharClass(List<CharRange> ranges) implements RegexNode {

		static final char PRINTABLE_FIRST = 0x20;
		static final char PRINTABLE_LAST = 0x7E;

		public CharClass {
			ranges = normalize(ranges);
		}

		public static CharClass of(CharRange... ranges) {
			return new CharClass(List.of(ranges));
		}

		public static CharClass printable() {
			return of(new CharRange(PRINTABLE_FIRST, PRINTABLE_LAST));
		}

		public int size() {
			int size = 0;
			for (CharRange range : ranges) {
				size += range.size();
			}
			return size;
		}

		public boolean isEmpty() {
			return ranges.isEmpty();
		}

		/**
		 * The {@code index}-th member in ascending order.
		 */
		public char memberAt(int index) {
			int remaining = index;
			for (CharRange range : ranges) {
				if (remaining < range.size()) {
					return (char) (range.first() + remaining);
				}
				remaining -= range.size();
			}
			throw new IndexOutOfBoundsException("Class has " + size() + " members, asked for " + index);
		}

		public boolean contains(char c) {
			for (CharRange range : ranges) {
				if (c >= range.first() && c <= range.last()) {
					return true;
				}
			}
			return false;
		}

		/**
		 * Printable ASCII characters not in this class.
		 */
		public CharClass complement() {
			List<CharRange> result = new ArrayList<>();
			int next = PRINTABLE_FIRST;
			for (CharRange range : ranges) {
				if (range.last() < PRINTABLE_FIRST) {
					continue;
				}
				if (range.first() > PRINTABLE_LAST) {
					break;
				}
				if (range.first() > next) {
					result.add(new CharRange((char) next, (char) (range.first() - 1)));
				}
				next = Math.max(next, range.last() + 1);
			}
			if (next <= PRINTABLE_LAST) {
				result.add(new CharRange((char) next, PRINTABLE_LAST));
			}
			return new CharClass(result);
		}

		private static List<CharRange> normalize(List<CharRange> input) {
			List<CharRange> sorted = new ArrayList<>(input);
			sorted.sort(Comparator.comparingInt(CharRange::first));
			List<CharRange> merged = new ArrayList<>();
			for (CharRange range : sorted) {
				if (!merged.isEmpty()) {
					CharRange last = merged.get(merged.size() - 1);
					if (range.first() <= last.last() + 1) {
						char end = (char) Math.max(last.last(), range.last());
						merged.set(merged.size() - 1, new CharRange(last.first(), end));
						continue;
					}
				}
				merged.add(range);
			}
			return List.copyOf(merged);
		}
	}

	record CharRange(char first, char last) {
		public CharRange {
			if (last < first) {
				throw new IllegalArgumentException("Range out of order: " + first + "-" + last);
			}
		}

		public static CharRange single(char c) {
			return new CharRange(c, c);
		}

		public int size() {
			return last - first + 1;
		}
	}
}
