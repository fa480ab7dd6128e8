package tuff.porter.parse.java;

import java.util.List;

/**
 * Rebuilds readable text from tokens: a single space goes between two tokens exactly
 * when they were not adjacent in the source.
 */
public final class SourceText {
	private SourceText() {
		// utility class
	}

	public static String of(List<JavaToken> tokens) {
		StringBuilder sb = new StringBuilder();
		JavaToken prev = null;
		for (JavaToken t : tokens) {
			if (prev != null && !prev.span().isAdjacentTo(t.span())) {
				sb.append(' ');
			}
			sb.append(t.lexeme());
			prev = t;
		}
		return sb.toString();
	}
}
