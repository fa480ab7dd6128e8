package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaClassDecl;
import tuff.porter.ast.java.JavaMemberDecl;
import tuff.porter.ast.java.JavaModifiers;
import tuff.porter.ast.java.JavaTypeKind;
import tuff.porter.ast.java.JavaTypeParameter;
import tuff.porter.ast.java.JavaTypeRef;
import tuff.porter.parse.java.GroupKind;
import tuff.porter.parse.java.JavaToken;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenInputStream;

import java.util.List;

/**
 * modifiers ('class' | 'interface') name typeParameters? ('extends' types)? ('implements' types)? { members }
 *
 * Shared by the top-level and member class matchers. The body is not looked at while
 * matching; its members are dispatched only when the declaration is parsed.
 */
final class ClassDeclarations {
	private final JavaMatchers matchers;

	ClassDeclarations(JavaMatchers matchers) {
		this.matchers = matchers;
	}

	boolean isMatch(TokenInputStream s) {
		Modifiers.read(s);
		if (kind(s) == null) {
			return false;
		}
		s.advance();
		if (Syntax.ident(s) == null || TypeReader.readTypeParameters(s) == null
				|| TypeReader.readClause(s, "extends") == null || TypeReader.readClause(s, "implements") == null) {
			return false;
		}
		if (!s.isGroup(GroupKind.CURLY)) {
			return false;
		}
		s.advance();
		return true;
	}

	JavaClassDecl parse(TokenInputStream s) {
		TokenElement start = s.current();
		JavaModifiers modifiers = Modifiers.read(s);
		JavaTypeKind kind = Syntax.require(kind(s), s, "'class' or 'interface'");
		s.advance();
		JavaToken name = Syntax.require(Syntax.ident(s), s, "type name");
		List<JavaTypeParameter> typeParameters = Syntax.require(TypeReader.readTypeParameters(s), s,
				"type parameters");
		List<JavaTypeRef> extendsTypes = Syntax.require(TypeReader.readClause(s, "extends"), s, "extends clause");
		List<JavaTypeRef> implementsTypes = Syntax.require(TypeReader.readClause(s, "implements"), s,
				"implements clause");
		Syntax.require(s.isGroup(GroupKind.CURLY) ? s.current() : null, s, "class body");
		TokenInputStream body = s.subStreamForCurrentGroup();
		s.advance();
		List<JavaMemberDecl> members = matchers.classBody().dispatch(body);
		return new JavaClassDecl(modifiers, kind, name.lexeme(), typeParameters, extendsTypes, implementsTypes,
				members, Syntax.spanFrom(start, s));
	}

	private static JavaTypeKind kind(TokenInputStream s) {
		if (s.isKeyword("class")) {
			return JavaTypeKind.CLASS;
		}
		if (s.isKeyword("interface")) {
			return JavaTypeKind.INTERFACE;
		}
		return null;
	}
}
