package tuff.porter.parse.java.match;

import tuff.porter.ast.SourceSpan;
import tuff.porter.ast.java.JavaAnonymousClassExpr;
import tuff.porter.ast.java.JavaArrayType;
import tuff.porter.ast.java.JavaExpr;
import tuff.porter.ast.java.JavaFragment;
import tuff.porter.ast.java.JavaGroupFragment;
import tuff.porter.ast.java.JavaMemberDecl;
import tuff.porter.ast.java.JavaOpaqueBody;
import tuff.porter.ast.java.JavaOpaqueExpr;
import tuff.porter.ast.java.JavaTokenFragment;
import tuff.porter.ast.java.JavaTypeRef;
import tuff.porter.parse.java.GroupKind;
import tuff.porter.parse.java.JavaToken;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenGroup;
import tuff.porter.parse.java.TokenInputStream;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an opaque element span into fragments, parsing every {@code new T(...) {...}} it
 * finds (at any depth) into a {@link JavaAnonymousClassExpr}. Everything else is kept
 * token for token.
 */
final class AnonymousClassScanner {
	private final JavaMatchers matchers;

	AnonymousClassScanner(JavaMatchers matchers) {
		this.matchers = matchers;
	}

	JavaOpaqueBody body(TokenGroup block) {
		return new JavaOpaqueBody(group(block));
	}

	/**
	 * An initializer that is exactly one anonymous class expression is returned as that
	 * expression.
	 */
	JavaExpr expression(List<TokenElement> elements, SourceSpan span) {
		List<JavaFragment> fragments = scan(elements);
		if (fragments.size() == 1 && fragments.get(0) instanceof JavaAnonymousClassExpr anonymous) {
			return anonymous;
		}
		return new JavaOpaqueExpr(fragments, span);
	}

	List<JavaFragment> scan(List<TokenElement> elements) {
		TokenInputStream s = TokenInputStream.of(elements);
		List<JavaFragment> fragments = new ArrayList<>();
		while (s.hasNext()) {
			if (s.isKeyword("new")) {
				TokenInputStream trial = s.peekStream();
				JavaAnonymousClassExpr anonymous = anonymousClass(trial);
				if (anonymous != null) {
					fragments.add(anonymous);
					s.commit(trial);
					continue;
				}
			}
			TokenElement element = s.advance();
			if (element instanceof TokenGroup g) {
				fragments.add(group(g));
			} else if (element instanceof JavaToken t) {
				fragments.add(new JavaTokenFragment(t));
			}
		}
		return List.copyOf(fragments);
	}

	JavaGroupFragment group(TokenGroup group) {
		return new JavaGroupFragment(group.kind(), group.open(), group.close(), scan(group.children()));
	}

	private JavaAnonymousClassExpr anonymousClass(TokenInputStream s) {
		JavaToken newToken = (JavaToken) s.advance();
		JavaTypeRef base = TypeReader.readType(s);
		if (base == null || base instanceof JavaArrayType || !s.isGroup(GroupKind.ROUND)) {
			return null;
		}
		TokenGroup arguments = Syntax.group(s);
		if (!s.isGroup(GroupKind.CURLY)) {
			return null;
		}
		TokenInputStream body = s.subStreamForCurrentGroup();
		s.advance();
		List<JavaMemberDecl> members = matchers.classBody().dispatch(body);
		return new JavaAnonymousClassExpr(base, group(arguments), members, Syntax.spanFrom(newToken, s));
	}
}
