package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaImportDecl;
import tuff.porter.parse.java.JavaToken;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenInputStream;

/**
 * 'import' 'static'? qualified.name ('.' '*')? ';'
 */
final class ImportMatcher implements ConstructMatcher<JavaImportDecl> {
	@Override
	public String name() {
		return "import";
	}

	@Override
	public boolean isMatch(TokenInputStream s) {
		if (!Syntax.acceptKeyword(s, "import")) {
			return false;
		}
		Syntax.acceptKeyword(s, "static");
		if (Syntax.qualifiedName(s) == null) {
			return false;
		}
		acceptOnDemand(s);
		return Syntax.acceptPunctuation(s, ";");
	}

	@Override
	public JavaImportDecl parse(TokenInputStream s) {
		TokenElement start = s.current();
		Syntax.requireKeyword(s, "import");
		boolean isStatic = Syntax.acceptKeyword(s, "static");
		String name = Syntax.require(Syntax.qualifiedName(s), s, "imported name");
		boolean onDemand = acceptOnDemand(s);
		Syntax.requirePunctuation(s, ";");
		return new JavaImportDecl(isStatic, name, onDemand, Syntax.spanFrom(start, s));
	}

	private static boolean acceptOnDemand(TokenInputStream s) {
		boolean star = s.isPunctuation(".")
				&& s.peek(1).filter(e -> e instanceof JavaToken t && t.isOperator("*")).isPresent();
		if (star) {
			s.advance();
			s.advance();
		}
		return star;
	}
}
