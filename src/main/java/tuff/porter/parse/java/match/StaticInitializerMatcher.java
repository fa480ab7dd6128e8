package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaStaticInitializer;
import tuff.porter.parse.java.GroupKind;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenInputStream;

/**
 * 'static' { body }
 */
final class StaticInitializerMatcher implements ConstructMatcher<JavaStaticInitializer> {
	private final AnonymousClassScanner anonymousClasses;

	StaticInitializerMatcher(AnonymousClassScanner anonymousClasses) {
		this.anonymousClasses = anonymousClasses;
	}

	@Override
	public String name() {
		return "static initializer";
	}

	@Override
	public boolean isMatch(TokenInputStream s) {
		if (!Syntax.acceptKeyword(s, "static") || !s.isGroup(GroupKind.CURLY)) {
			return false;
		}
		s.advance();
		return true;
	}

	@Override
	public JavaStaticInitializer parse(TokenInputStream s) {
		TokenElement start = s.current();
		Syntax.requireKeyword(s, "static");
		Syntax.require(s.isGroup(GroupKind.CURLY) ? s.current() : null, s, "initializer body");
		return new JavaStaticInitializer(anonymousClasses.body(Syntax.group(s)), Syntax.spanFrom(start, s));
	}
}
