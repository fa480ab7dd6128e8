package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaArrayType;
import tuff.porter.ast.java.JavaIdentType;
import tuff.porter.ast.java.JavaParameterizedType;
import tuff.porter.ast.java.JavaTypeParameter;
import tuff.porter.ast.java.JavaTypeRef;
import tuff.porter.ast.java.JavaWildcardType;
import tuff.porter.parse.java.GroupKind;
import tuff.porter.parse.java.JavaToken;
import tuff.porter.parse.java.JavaTokenType;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenGroup;
import tuff.porter.parse.java.TokenInputStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Type grammar: primitive or qualified name, optional type arguments, trailing '[]' groups.
 *
 * Every method returns null without throwing when the input does not fit; the stream is
 * then left wherever the scan stopped.
 */
final class TypeReader {
	static final Set<String> PRIMITIVES = Set.of(
			"boolean", "byte", "char", "short", "int", "long", "float", "double", "void");

	private TypeReader() {
		// utility class
	}

	static JavaTypeRef readType(TokenInputStream s) {
		skipTypeAnnotations(s);
		if (!s.hasNext()) {
			return null;
		}
		TokenElement start = s.current();
		if (start instanceof JavaToken t && t.type() == JavaTokenType.KEYWORD && PRIMITIVES.contains(t.lexeme())) {
			s.advance();
			return readDimensions(s, new JavaIdentType(t.lexeme(), t.span()));
		}

		String name = Syntax.qualifiedName(s);
		if (name == null) {
			return null;
		}
		JavaIdentType base = new JavaIdentType(name, Syntax.spanFrom(start, s));
		JavaTypeRef type = base;
		if (s.isGroup(GroupKind.ANGLE)) {
			List<JavaTypeRef> arguments = readTypeArguments(s);
			if (arguments == null) {
				return null;
			}
			type = new JavaParameterizedType(base, arguments, Syntax.spanFrom(start, s));
		}
		return readDimensions(s, type);
	}

	/**
	 * Type-use annotations ({@code @Ann}, {@code @Ann(...)}) are read past and not kept.
	 */
	private static void skipTypeAnnotations(TokenInputStream s) {
		while (s.isPunctuation("@") && Syntax.isIdentAt(s, 1)) {
			s.advance();
			Syntax.qualifiedName(s);
			if (s.isGroup(GroupKind.ROUND)) {
				s.advance();
			}
		}
	}

	static JavaTypeRef readDimensions(TokenInputStream s, JavaTypeRef type) {
		JavaTypeRef result = type;
		while (s.isGroup(GroupKind.SQUARE) && ((TokenGroup) s.current()).isEmpty()) {
			s.advance();
			result = new JavaArrayType(result, result.span().to(s.previous().span()));
		}
		return result;
	}

	/**
	 * Reads the angle group at the cursor as type arguments. An empty group is a diamond.
	 */
	static List<JavaTypeRef> readTypeArguments(TokenInputStream s) {
		TokenInputStream in = s.subStreamForCurrentGroup();
		s.advance();
		List<JavaTypeRef> arguments = new ArrayList<>();
		while (in.hasNext()) {
			JavaTypeRef argument = in.isOperator("?") ? readWildcard(in) : readType(in);
			if (argument == null) {
				return null;
			}
			arguments.add(argument);
			if (in.hasNext() && (!Syntax.acceptPunctuation(in, ",") || !in.hasNext())) {
				return null;
			}
		}
		return arguments;
	}

	private static JavaTypeRef readWildcard(TokenInputStream in) {
		JavaToken question = (JavaToken) in.advance();
		JavaWildcardType.Bound bound;
		if (Syntax.acceptKeyword(in, "extends")) {
			bound = JavaWildcardType.Bound.EXTENDS;
		} else if (Syntax.acceptKeyword(in, "super")) {
			bound = JavaWildcardType.Bound.SUPER;
		} else {
			return new JavaWildcardType(JavaWildcardType.Bound.NONE, null, question.span());
		}
		JavaTypeRef boundType = readType(in);
		if (boundType == null) {
			return null;
		}
		return new JavaWildcardType(bound, boundType, question.span().to(boundType.span()));
	}

	/**
	 * Optional {@code <T extends A & B, U>}; absent parameters give an empty list.
	 */
	static List<JavaTypeParameter> readTypeParameters(TokenInputStream s) {
		if (!s.isGroup(GroupKind.ANGLE)) {
			return List.of();
		}
		TokenInputStream in = s.subStreamForCurrentGroup();
		s.advance();
		List<JavaTypeParameter> parameters = new ArrayList<>();
		if (!in.hasNext()) {
			return null;
		}
		while (in.hasNext()) {
			JavaToken name = Syntax.ident(in);
			if (name == null) {
				return null;
			}
			List<JavaTypeRef> bounds = new ArrayList<>();
			if (Syntax.acceptKeyword(in, "extends")) {
				do {
					JavaTypeRef bound = readType(in);
					if (bound == null) {
						return null;
					}
					bounds.add(bound);
				} while (acceptAmpersand(in));
			}
			parameters.add(new JavaTypeParameter(name.lexeme(), List.copyOf(bounds), Syntax.spanFrom(name, in)));
			if (in.hasNext() && (!Syntax.acceptPunctuation(in, ",") || !in.hasNext())) {
				return null;
			}
		}
		return List.copyOf(parameters);
	}

	/**
	 * type (',' type)*
	 */
	static List<JavaTypeRef> readTypeList(TokenInputStream s) {
		List<JavaTypeRef> types = new ArrayList<>();
		do {
			JavaTypeRef type = readType(s);
			if (type == null) {
				return null;
			}
			types.add(type);
		} while (Syntax.acceptPunctuation(s, ","));
		return List.copyOf(types);
	}

	/**
	 * Optional clause introduced by {@code keyword}; absent clause gives an empty list.
	 */
	static List<JavaTypeRef> readClause(TokenInputStream s, String keyword) {
		if (!Syntax.acceptKeyword(s, keyword)) {
			return List.of();
		}
		return readTypeList(s);
	}

	private static boolean acceptAmpersand(TokenInputStream in) {
		if (!in.isOperator("&")) {
			return false;
		}
		in.advance();
		return true;
	}
}
