package org.javai.bnfgen.grammar;

/**
 * Per-alternative bound on how many times the alternative may be selected within
 * a single generation run.
 */
public sealed interface InvokeLimit {

	Unlimited UNLIMITED = new Unlimited();

	static InvokeLimit unlimited() {
		return UNLIMITED;
	}

	/**
	 * {@code {n}}: exactly {@code n} selections.
	 */
	static Limited exactly(int count) {
		return new Limited(count, count);
	}

	/**
	 * {@code {min,max}}.
	 */
	static Limited between(int min, int max) {
		return new Limited(min, max);
	}

	/**
	 * {@code {min,}}: at least {@code min} selections, no upper bound.
	 */
	static Limited atLeast(int min) {
		return new Limited(min, Limited.UNBOUNDED);
	}

	/**
	 * Whether an alternative selected {@code count} times may be selected again.
	 */
	boolean allowsAnother(int count);

	/**
	 * Whether an alternative selected {@code count} times still owes selections.
	 */
	boolean belowMinimum(int count);

	/**
	 * Whether the limit caps the number of selections.
	 */
	boolean isBounded();

	record Unlimited() implements InvokeLimit {
		@Override
		public boolean allowsAnother(int count) {
			return true;
		}

		@Override
		public boolean belowMinimum(int count) {
			return false;
		}

		@Override
		public boolean isBounded() {
			return false;
		}

		@Override
		public String toString() {
			return "";
		}
	}

	/**
	 * {@code min <= max} is not enforced here; malformed ranges are reported by the validator.
	 */
	record Limited(int min, int max) implements InvokeLimit {

		public static final int UNBOUNDED = Integer.MAX_VALUE;

		public Limited {
			if (min < 0 || max < 0) {
				throw new IllegalArgumentException("Invoke limits must not be negative: {" + min + "," + max + "}");
			}
		}

		public boolean isValidRange() {
			return min <= max;
		}

		@Override
		public boolean allowsAnother(int count) {
			return count < max;
		}

		@Override
		public boolean belowMinimum(int count) {
			return count < min;
		}

		@Override
		public boolean isBounded() {
			return max != UNBOUNDED;
		}

		@Override
		public String toString() {
			if (min == max) {
				return "{" + min + "}";
			}
			return isBounded() ? "{" + min + "," + max + "}" : "{" + min + ",}";
		}
	}
}
