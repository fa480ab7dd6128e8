package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaNode;
import tuff.porter.parse.java.TokenInputStream;

/**
 * Recognizer/parser pair for one kind of declaration.
 *
 * {@link #isMatch} runs on a stream nobody else reads from and leaves it at the end of the
 * construct. {@link #parse} must stop at exactly that same position.
 */
public interface ConstructMatcher<T extends JavaNode> {
	String name();

	/**
	 * Fail-fast, non-recovering scan. Returns false at the first violated expectation.
	 */
	boolean isMatch(TokenInputStream stream);

	/**
	 * Consumes the construct {@link #isMatch} accepted and builds its node.
	 */
	T parse(TokenInputStream stream);
}
