package tuff.porter.parse.java.match;

import tuff.porter.ErrorKind;
import tuff.porter.TranspileException;
import tuff.porter.parse.java.TokenElement;

/**
 * No matcher accepted the element at the dispatcher's cursor.
 */
public class UnrecognizedMemberException extends TranspileException {
	private final TokenElement element;

	public UnrecognizedMemberException(TokenElement element) {
		super(ErrorKind.UNRECOGNIZED_MEMBER, "Unrecognized declaration", element.firstToken().line(),
				element.firstToken().column(), element.text());
		this.element = element;
	}

	public TokenElement element() {
		return element;
	}
}
