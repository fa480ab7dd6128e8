package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaConstructorDecl;
import tuff.porter.ast.java.JavaModifiers;
import tuff.porter.ast.java.JavaParam;
import tuff.porter.ast.java.JavaTypeParameter;
import tuff.porter.ast.java.JavaTypeRef;
import tuff.porter.parse.java.GroupKind;
import tuff.porter.parse.java.JavaToken;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenInputStream;

import java.util.List;

/**
 * modifiers typeParameters? name (params) ('throws' types)? { body }
 *
 * No return type. A call statement such as {@code foo();} fails here because a ';' follows
 * the parameter group instead of a body.
 */
final class ConstructorMatcher implements ConstructMatcher<JavaConstructorDecl> {
	private final AnonymousClassScanner anonymousClasses;

	ConstructorMatcher(AnonymousClassScanner anonymousClasses) {
		this.anonymousClasses = anonymousClasses;
	}

	@Override
	public String name() {
		return "constructor";
	}

	@Override
	public boolean isMatch(TokenInputStream s) {
		Modifiers.read(s);
		if (TypeReader.readTypeParameters(s) == null || Syntax.ident(s) == null
				|| ParameterReader.readParameters(s) == null || TypeReader.readClause(s, "throws") == null) {
			return false;
		}
		if (!s.isGroup(GroupKind.CURLY)) {
			return false;
		}
		s.advance();
		return true;
	}

	@Override
	public JavaConstructorDecl parse(TokenInputStream s) {
		TokenElement start = s.current();
		JavaModifiers modifiers = Modifiers.read(s);
		List<JavaTypeParameter> typeParameters = Syntax.require(TypeReader.readTypeParameters(s), s,
				"type parameters");
		JavaToken name = Syntax.require(Syntax.ident(s), s, "constructor name");
		List<JavaParam> params = Syntax.require(ParameterReader.readParameters(s), s, "parameters");
		List<JavaTypeRef> throwsTypes = Syntax.require(TypeReader.readClause(s, "throws"), s, "throws clause");
		Syntax.require(s.isGroup(GroupKind.CURLY) ? s.current() : null, s, "constructor body");
		return new JavaConstructorDecl(modifiers, typeParameters, name.lexeme(), params, throwsTypes,
				anonymousClasses.body(Syntax.group(s)), Syntax.spanFrom(start, s));
	}
}
