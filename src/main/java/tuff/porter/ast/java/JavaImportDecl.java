package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

/**
 * {@code qualifiedName} never includes the trailing {@code .*} of an on-demand import.
 */
public record JavaImportDecl(boolean isStatic, String qualifiedName, boolean onDemand, SourceSpan span)
		implements JavaNode {
	public String simpleName() {
		int dot = qualifiedName.lastIndexOf('.');
		return dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1);
	}
}
