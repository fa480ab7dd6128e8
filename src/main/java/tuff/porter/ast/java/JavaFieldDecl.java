package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

/**
 * A single-declarator field. {@code init} is null when the field has no initializer.
 */
public record JavaFieldDecl(JavaModifiers modifiers, JavaTypeRef type, String name, JavaExpr init, SourceSpan span)
		implements JavaMemberDecl {
	public boolean hasInitializer() {
		return init != null;
	}
}
