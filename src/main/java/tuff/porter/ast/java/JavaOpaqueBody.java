package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

/**
 * A braced body kept as tokens. Anonymous class expressions inside it are already
 * parsed into {@link JavaAnonymousClassExpr} fragments.
 */
public record JavaOpaqueBody(JavaGroupFragment block) implements JavaNode {
	@Override
	public SourceSpan span() {
		return block.span();
	}
}
