package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

/**
 * A primitive or a (possibly qualified) class name without type arguments.
 */
public record JavaIdentType(String name, SourceSpan span) implements JavaTypeRef {
	public boolean isQualified() {
		return name.indexOf('.') >= 0;
	}
}
