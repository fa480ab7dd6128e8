package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaInstanceInitializer;
import tuff.porter.parse.java.GroupKind;
import tuff.porter.parse.java.TokenInputStream;

final class InstanceInitializerMatcher implements ConstructMatcher<JavaInstanceInitializer> {
	private final AnonymousClassScanner anonymousClasses;

	InstanceInitializerMatcher(AnonymousClassScanner anonymousClasses) {
		this.anonymousClasses = anonymousClasses;
	}

	@Override
	public String name() {
		return "instance initializer";
	}

	@Override
	public boolean isMatch(TokenInputStream s) {
		if (!s.isGroup(GroupKind.CURLY)) {
			return false;
		}
		s.advance();
		return true;
	}

	@Override
	public JavaInstanceInitializer parse(TokenInputStream s) {
		Syntax.require(s.isGroup(GroupKind.CURLY) ? s.current() : null, s, "initializer body");
		var body = anonymousClasses.body(Syntax.group(s));
		return new JavaInstanceInitializer(body, body.span());
	}
}
