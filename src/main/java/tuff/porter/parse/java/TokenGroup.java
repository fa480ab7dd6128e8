package tuff.porter.parse.java;

import tuff.porter.ast.SourceSpan;

import java.util.List;

/**
 * A matched bracket pair and everything between the brackets.
 *
 * Created once by {@link TokenGrouper}; the children list is immutable.
 */
public record TokenGroup(GroupKind kind, JavaToken open, JavaToken close, List<TokenElement> children)
		implements TokenElement {

	public TokenGroup {
		children = List.copyOf(children);
	}

	public boolean isEmpty() {
		return children.isEmpty();
	}

	@Override
	public SourceSpan span() {
		return open.span().to(close.span());
	}

	@Override
	public JavaToken firstToken() {
		return open;
	}

	@Override
	public String text() {
		return SourceText.of(TokenGrouper.flatten(List.of(this)));
	}
}
