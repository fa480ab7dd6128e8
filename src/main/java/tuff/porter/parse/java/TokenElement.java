package tuff.porter.parse.java;

import tuff.porter.ast.SourceSpan;

/**
 * An element of a grouped token sequence: either a plain token or a bracket group.
 */
public sealed interface TokenElement permits JavaToken, TokenGroup {
	SourceSpan span();

	/**
	 * The token that carries this element's position (the opening bracket for a group).
	 */
	JavaToken firstToken();

	/**
	 * Literal source-like text of the element, used in diagnostics.
	 */
	String text();
}
