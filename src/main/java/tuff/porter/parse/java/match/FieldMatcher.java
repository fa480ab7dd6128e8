package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaExpr;
import tuff.porter.ast.java.JavaFieldDecl;
import tuff.porter.ast.java.JavaModifiers;
import tuff.porter.ast.java.JavaTypeRef;
import tuff.porter.parse.java.JavaToken;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenInputStream;

import java.util.ArrayList;
import java.util.List;

/**
 * modifiers type name ('[]')* ('=' initializer)? ';'
 */
final class FieldMatcher implements ConstructMatcher<JavaFieldDecl> {
	private final AnonymousClassScanner anonymousClasses;

	FieldMatcher(AnonymousClassScanner anonymousClasses) {
		this.anonymousClasses = anonymousClasses;
	}

	@Override
	public String name() {
		return "field";
	}

	@Override
	public boolean isMatch(TokenInputStream s) {
		Modifiers.read(s);
		JavaTypeRef type = TypeReader.readType(s);
		if (type == null || Syntax.ident(s) == null) {
			return false;
		}
		TypeReader.readDimensions(s, type);
		if (Syntax.acceptPunctuation(s, ";")) {
			return true;
		}
		if (!s.isOperator("=")) {
			return false;
		}
		s.advance();
		return Syntax.skipToSemicolon(s);
	}

	@Override
	public JavaFieldDecl parse(TokenInputStream s) {
		TokenElement start = s.current();
		JavaModifiers modifiers = Modifiers.read(s);
		JavaTypeRef type = Syntax.require(TypeReader.readType(s), s, "field type");
		JavaToken name = Syntax.require(Syntax.ident(s), s, "field name");
		type = TypeReader.readDimensions(s, type);

		JavaExpr init = null;
		if (s.isOperator("=")) {
			s.advance();
			TokenElement first = s.current();
			List<TokenElement> elements = new ArrayList<>();
			while (s.hasNext() && !s.isPunctuation(";")) {
				elements.add(s.advance());
			}
			init = anonymousClasses.expression(elements, Syntax.spanFrom(first, s));
		}
		Syntax.requirePunctuation(s, ";");
		return new JavaFieldDecl(modifiers, type, name.lexeme(), init, Syntax.spanFrom(start, s));
	}
}
