package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;
import tuff.porter.parse.java.JavaToken;

public record JavaTokenFragment(JavaToken token) implements JavaFragment {
	@Override
	public SourceSpan span() {
		return token.span();
	}
}
