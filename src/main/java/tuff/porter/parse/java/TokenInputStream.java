package tuff.porter.parse.java;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Cursor over a shared, immutable list of grouped elements.
 *
 * Streams never copy the backing list. {@link #peekStream()} copies only the cursor, so a
 * trial scan on the derived stream leaves this one where it was.
 */
public final class TokenInputStream {
	private final List<TokenElement> elements;
	private int position;

	private TokenInputStream(List<TokenElement> elements, int position) {
		this.elements = elements;
		this.position = position;
	}

	public static TokenInputStream of(List<TokenElement> elements) {
		return new TokenInputStream(List.copyOf(elements), 0);
	}

	public boolean hasNext() {
		return position < elements.size();
	}

	public TokenElement current() {
		if (!hasNext()) {
			throw new NoSuchElementException("End of token stream at position " + position);
		}
		return elements.get(position);
	}

	public TokenElement advance() {
		TokenElement element = current();
		position++;
		return element;
	}

	/**
	 * Element {@code ahead} places past the cursor ({@code peek(0)} is the current element).
	 */
	public Optional<TokenElement> peek(int ahead) {
		int index = position + ahead;
		if (ahead < 0 || index >= elements.size()) {
			return Optional.empty();
		}
		return Optional.of(elements.get(index));
	}

	public Optional<TokenElement> peek() {
		return peek(1);
	}

	public TokenInputStream peekStream() {
		return new TokenInputStream(elements, position);
	}

	/**
	 * Stream over the interior of the current element, which must be a group. Does not
	 * advance this stream.
	 */
	public TokenInputStream subStreamForCurrentGroup() {
		if (!(current() instanceof TokenGroup group)) {
			throw new IllegalStateException("Expected a bracket group but found '" + current().text() + "'");
		}
		return new TokenInputStream(group.children(), 0);
	}

	/**
	 * The element most recently consumed by {@link #advance()}.
	 */
	public TokenElement previous() {
		if (position == 0) {
			throw new NoSuchElementException("Nothing consumed yet");
		}
		return elements.get(position - 1);
	}

	public int position() {
		return position;
	}

	/**
	 * Moves this stream to where {@code derived} stands. Only streams derived from this
	 * one through {@link #peekStream()} are accepted, and only forward.
	 */
	public void commit(TokenInputStream derived) {
		if (derived.elements != elements) {
			throw new IllegalArgumentException("Stream was not derived from this stream");
		}
		if (derived.position < position) {
			throw new IllegalArgumentException("Cannot move stream backwards from " + position + " to "
					+ derived.position);
		}
		position = derived.position;
	}

	public List<TokenElement> remaining() {
		return elements.subList(position, elements.size());
	}

	public boolean isKeyword(String keyword) {
		return hasNext() && current() instanceof JavaToken t && t.isKeyword(keyword);
	}

	public boolean isPunctuation(String symbol) {
		return hasNext() && current() instanceof JavaToken t && t.isPunctuation(symbol);
	}

	public boolean isOperator(String symbol) {
		return hasNext() && current() instanceof JavaToken t && t.isOperator(symbol);
	}

	public boolean isIdent() {
		return hasNext() && current() instanceof JavaToken t && t.type() == JavaTokenType.IDENT;
	}

	public boolean isGroup(GroupKind kind) {
		return hasNext() && current() instanceof TokenGroup g && g.kind() == kind;
	}
}
