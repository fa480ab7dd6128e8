package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaMethodDecl;
import tuff.porter.ast.java.JavaModifiers;
import tuff.porter.ast.java.JavaOpaqueBody;
import tuff.porter.ast.java.JavaParam;
import tuff.porter.ast.java.JavaTypeParameter;
import tuff.porter.ast.java.JavaTypeRef;
import tuff.porter.parse.java.GroupKind;
import tuff.porter.parse.java.JavaToken;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenInputStream;

import java.util.List;

/**
 * modifiers typeParameters? type name (params) ('[]')* ('throws' types)? ({ body } | ';')
 *
 * The name must be followed directly by the parameter group, which is what tells a
 * declaration apart from a field whose initializer calls a method.
 */
final class MethodMatcher implements ConstructMatcher<JavaMethodDecl> {
	private final AnonymousClassScanner anonymousClasses;

	MethodMatcher(AnonymousClassScanner anonymousClasses) {
		this.anonymousClasses = anonymousClasses;
	}

	@Override
	public String name() {
		return "method";
	}

	@Override
	public boolean isMatch(TokenInputStream s) {
		Modifiers.read(s);
		if (TypeReader.readTypeParameters(s) == null) {
			return false;
		}
		JavaTypeRef returnType = TypeReader.readType(s);
		if (returnType == null || Syntax.ident(s) == null || ParameterReader.readParameters(s) == null) {
			return false;
		}
		TypeReader.readDimensions(s, returnType);
		if (TypeReader.readClause(s, "throws") == null) {
			return false;
		}
		if (s.isGroup(GroupKind.CURLY)) {
			s.advance();
			return true;
		}
		return Syntax.acceptPunctuation(s, ";");
	}

	@Override
	public JavaMethodDecl parse(TokenInputStream s) {
		TokenElement start = s.current();
		JavaModifiers modifiers = Modifiers.read(s);
		List<JavaTypeParameter> typeParameters = Syntax.require(TypeReader.readTypeParameters(s), s,
				"type parameters");
		JavaTypeRef returnType = Syntax.require(TypeReader.readType(s), s, "return type");
		JavaToken name = Syntax.require(Syntax.ident(s), s, "method name");
		List<JavaParam> params = Syntax.require(ParameterReader.readParameters(s), s, "parameters");
		returnType = TypeReader.readDimensions(s, returnType);
		List<JavaTypeRef> throwsTypes = Syntax.require(TypeReader.readClause(s, "throws"), s, "throws clause");

		JavaOpaqueBody body = null;
		if (s.isGroup(GroupKind.CURLY)) {
			body = anonymousClasses.body(Syntax.group(s));
		} else {
			Syntax.requirePunctuation(s, ";");
		}
		return new JavaMethodDecl(modifiers, typeParameters, returnType, name.lexeme(), params, throwsTypes, body,
				Syntax.spanFrom(start, s));
	}
}
