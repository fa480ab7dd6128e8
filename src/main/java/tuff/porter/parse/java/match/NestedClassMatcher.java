package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaNestedClassDecl;
import tuff.porter.parse.java.TokenInputStream;

final class NestedClassMatcher implements ConstructMatcher<JavaNestedClassDecl> {
	private final ClassDeclarations classes;

	NestedClassMatcher(ClassDeclarations classes) {
		this.classes = classes;
	}

	@Override
	public String name() {
		return "nested class";
	}

	@Override
	public boolean isMatch(TokenInputStream s) {
		return classes.isMatch(s);
	}

	@Override
	public JavaNestedClassDecl parse(TokenInputStream s) {
		return new JavaNestedClassDecl(classes.parse(s));
	}
}
