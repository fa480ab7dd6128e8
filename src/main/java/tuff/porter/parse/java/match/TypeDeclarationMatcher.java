package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaClassDecl;
import tuff.porter.parse.java.TokenInputStream;

final class TypeDeclarationMatcher implements ConstructMatcher<JavaClassDecl> {
	private final ClassDeclarations classes;

	TypeDeclarationMatcher(ClassDeclarations classes) {
		this.classes = classes;
	}

	@Override
	public String name() {
		return "type declaration";
	}

	@Override
	public boolean isMatch(TokenInputStream s) {
		return classes.isMatch(s);
	}

	@Override
	public JavaClassDecl parse(TokenInputStream s) {
		return classes.parse(s);
	}
}
