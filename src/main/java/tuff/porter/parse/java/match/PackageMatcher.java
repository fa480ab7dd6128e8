package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaPackageDecl;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenInputStream;

/**
 * 'package' qualified.name ';'
 */
final class PackageMatcher implements ConstructMatcher<JavaPackageDecl> {
	@Override
	public String name() {
		return "package";
	}

	@Override
	public boolean isMatch(TokenInputStream s) {
		return Syntax.acceptKeyword(s, "package") && Syntax.qualifiedName(s) != null
				&& Syntax.acceptPunctuation(s, ";");
	}

	@Override
	public JavaPackageDecl parse(TokenInputStream s) {
		TokenElement start = s.current();
		Syntax.requireKeyword(s, "package");
		String name = Syntax.require(Syntax.qualifiedName(s), s, "package name");
		Syntax.requirePunctuation(s, ";");
		return new JavaPackageDecl(name, Syntax.spanFrom(start, s));
	}
}
