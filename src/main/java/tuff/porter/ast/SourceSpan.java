package tuff.porter.ast;

/**
 * Source span for diagnostics.
 *
 * Offsets are 0-based character indices into the original source text. {@code line} and
 * {@code column} are 1-based and describe {@code startOffset}; 0 means unknown.
 */
public record SourceSpan(int startOffset, int endOffset, int line, int column) {
	public static final SourceSpan NONE = new SourceSpan(-1, -1);

	public SourceSpan(int startOffset, int endOffset) {
		this(startOffset, endOffset, 0, 0);
	}

	/**
	 * Span from the start of this one to the end of {@code end}.
	 */
	public SourceSpan to(SourceSpan end) {
		return new SourceSpan(startOffset, end.endOffset(), line, column);
	}

	public boolean isAdjacentTo(SourceSpan next) {
		return endOffset == next.startOffset();
	}
}
