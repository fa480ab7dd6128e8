package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

import java.util.List;

public record JavaNestedClassDecl(JavaClassDecl declaration) implements JavaMemberDecl {
	public String name() {
		return declaration.name();
	}

	public List<JavaMemberDecl> members() {
		return declaration.members();
	}

	@Override
	public SourceSpan span() {
		return declaration.span();
	}
}
