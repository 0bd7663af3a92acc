package org.javai.bnfgen.regex;

import java.util.Objects;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * A compiled pattern that draws random strings from its language.
 * <p>
 * Literals emit themselves, classes draw one member uniformly, alternation draws a
 * branch uniformly and bounded repetition draws its count uniformly from the range.
 * Unbounded repetition draws from {@code [min, min + UNBOUNDED_REPEAT_SPAN]}.
 * <p>
 * Instances are immutable and may be shared between threads; all randomness comes
 * from the caller's generator.
 */
public final class RegexSynthesizer {

	/**
	 * Extra repetitions allowed above the minimum for {@code *}, {@code +} and {@code {n,}}.
	 */
	public static final int UNBOUNDED_REPEAT_SPAN = 10;

	/**
	 * Draws attempted before giving up on avoiding literal terminals.
	 */
	public static final int MAX_AVOID_ATTEMPTS = 100;

	private final String pattern;
	private final RegexNode root;

	private RegexSynthesizer(String pattern, RegexNode root) {
		this.pattern = pattern;
		this.root = root;
	}

	/**
	 * Compile a pattern.
	 *
	 * @throws RegexCompileException if the pattern is malformed
	 */
	public static RegexSynthesizer compile(String pattern) {
		return new RegexSynthesizer(pattern, RegexParser.parse(pattern));
	}

	public String pattern() {
		return pattern;
	}

	RegexNode root() {
		return root;
	}

	/**
	 * Draw a string that is not a member of {@code avoid}.
	 *
	 * @throws RegexAvoidRetryExceededException if every one of {@link #MAX_AVOID_ATTEMPTS}
	 *         draws landed in {@code avoid}
	 */
	public String generate(RandomGenerator random, Set<String> avoid) {
		Objects.requireNonNull(random, "random must not be null");
		Objects.requireNonNull(avoid, "avoid must not be null");
		for (int attempt = 0; attempt < MAX_AVOID_ATTEMPTS; attempt++) {
			String candidate = sample(random);
			if (!avoid.contains(candidate)) {
				return candidate;
			}
		}
		throw new RegexAvoidRetryExceededException(pattern, MAX_AVOID_ATTEMPTS);
	}

	/**
	 * Draw one string without any avoidance.
	 */
	public String sample(RandomGenerator random) {
		StringBuilder sb = new StringBuilder();
		emit(root, random, sb);
		return sb.toString();
	}

	private static void emit(RegexNode node, RandomGenerator random, StringBuilder out) {
		if (node instanceof RegexNode.Empty) {
			return;
		}
		if (node instanceof RegexNode.Literal literal) {
			out.append(literal.text());
		} else if (node instanceof RegexNode.CharClass cls) {
			out.append(cls.memberAt(random.nextInt(cls.size())));
		} else if (node instanceof RegexNode.Concat concat) {
			for (RegexNode part : concat.parts()) {
				emit(part, random, out);
			}
		} else if (node instanceof RegexNode.Alternation alternation) {
			int branch = random.nextInt(alternation.branches().size());
			emit(alternation.branches().get(branch), random, out);
		} else if (node instanceof RegexNode.Repeat repeat) {
			long max = repeat.isUnbounded() ? (long) repeat.min() + UNBOUNDED_REPEAT_SPAN : repeat.max();
			int count = repeat.min() + random.nextInt(Math.toIntExact(max - repeat.min() + 1));
			for (int i = 0; i < count; i++) {
				emit(repeat.body(), random, out);
			}
		}
	}

	@Override
	public String toString() {
		return "re(\"" + pattern + "\")";
	}
}
