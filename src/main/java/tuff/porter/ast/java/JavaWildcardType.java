package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

/**
 * {@code ?}, {@code ? extends T} or {@code ? super T}; {@code boundType} is null for an
 * unbounded wildcard.
 */
public record JavaWildcardType(Bound bound, JavaTypeRef boundType, SourceSpan span) implements JavaTypeRef {
	public enum Bound {
		NONE,
		EXTENDS,
		SUPER
	}
}
