package tuff.porter.parse.java;

import tuff.porter.ErrorKind;
import tuff.porter.TranspileException;

/**
 * Thrown by {@link TokenGrouper} when brackets do not nest.
 */
public class UnbalancedBracketException extends TranspileException {
	private final JavaToken token;

	public UnbalancedBracketException(String what, JavaToken token) {
		super(ErrorKind.UNBALANCED_BRACKET, what, token.line(), token.column(), token.lexeme());
		this.token = token;
	}

	public JavaToken token() {
		return token;
	}
}
