package org.javai.bnfgen.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.javai.bnfgen.grammar.Span;
import org.javai.bnfgen.parse.BnfParseException;
import org.javai.bnfgen.validate.Diagnostic;
import org.javai.bnfgen.validate.DiagnosticSet;

/**
 * Renders findings as plain text against the grammar source they refer to.
 *
 * <pre>
 * error: Undefined non-terminal: No rule named 'X' is defined
 *  --&gt; 1:9
 *   |
 * 1 | &lt;S&gt; ::= &lt;X&gt; ;
 *   |         ^^^
 * </pre>
 *
 * Secondary spans, such as the earlier definition of a duplicated rule, are rendered
 * below the primary one. Diagnostics without a known span render as the header only.
 */
public final class DiagnosticReporter {

	private final String source;
	private final List<Integer> lineStarts;

	public DiagnosticReporter(String source) {
		this.source = Objects.requireNonNull(source, "source must not be null");
		this.lineStarts = lineStarts(source);
	}

	public String render(DiagnosticSet diagnostics) {
		List<String> blocks = new ArrayList<>();
		for (Diagnostic diagnostic : diagnostics) {
			blocks.add(render(diagnostic));
		}
		return String.join("\n", blocks);
	}

	public String render(Diagnostic diagnostic) {
		StringBuilder out = new StringBuilder(diagnostic.toString()).append('\n');
		List<Span> spans = diagnostic.spans();
		for (int i = 0; i < spans.size(); i++) {
			Span span = spans.get(i);
			if (span.isKnown() && span.start() <= source.length()) {
				excerpt(out, span, i == 0 ? null : "also here");
			}
		}
		return out.toString();
	}

	public String render(BnfParseException exception) {
		StringBuilder out = new StringBuilder("error: ").append(exception.getMessage()).append('\n');
		int position = Math.min(Math.max(exception.position(), 0), source.length());
		excerpt(out, Span.of(position, position + 1), null);
		return out.toString();
	}

	/**
	 * One-based line and column of {@code offset}.
	 */
	public int[] lineAndColumn(int offset) {
		int line = lineIndex(offset);
		return new int[] { line + 1, offset - lineStarts.get(line) + 1 };
	}

	private void excerpt(StringBuilder out, Span span, String label) {
		int line = lineIndex(span.start());
		int lineStart = lineStarts.get(line);
		int lineEnd = line + 1 < lineStarts.size() ? lineStarts.get(line + 1) - 1 : source.length();
		String text = StringUtils.stripEnd(source.substring(lineStart, lineEnd), "\r");
		String number = String.valueOf(line + 1);
		String gutter = StringUtils.repeat(' ', number.length());

		int column = span.start() - lineStart;
		int width = Math.max(1, Math.min(span.end(), lineStart + text.length()) - span.start());

		out.append(gutter).append("--> ").append(line + 1).append(':').append(column + 1).append('\n');
		out.append(gutter).append(" |\n");
		out.append(number).append(" | ").append(text).append('\n');
		out.append(gutter).append(" | ").append(StringUtils.repeat(' ', column)).append(StringUtils.repeat('^', width));
		if (label != null) {
			out.append(' ').append(label);
		}
		out.append('\n');
	}

	private int lineIndex(int offset) {
		int low = 0;
		int high = lineStarts.size() - 1;
		while (low < high) {
			int mid = (low + high + 1) >>> 1;
			if (lineStarts.get(mid) <= offset) {
				low = mid;
			} else {
				high = mid - 1;
			}
		}
		return low;
	}

	private static List<Integer> lineStarts(String source) {
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < source.length(); i++) {
			if (source.charAt(i) == '\n') {
				starts.add(i + 1);
			}
		}
		return starts;
	}
}
