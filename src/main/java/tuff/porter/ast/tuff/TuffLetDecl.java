package tuff.porter.ast.tuff;

import tuff.porter.ast.SourceSpan;

/**
 * {@code init} is null when there is no initializer.
 */
public record TuffLetDecl(boolean isStatic, boolean isMutable, String name, String type, String init,
		SourceSpan span) implements TuffMember {
}
