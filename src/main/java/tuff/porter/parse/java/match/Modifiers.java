package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaModifiers;
import tuff.porter.parse.java.GroupKind;
import tuff.porter.parse.java.JavaToken;
import tuff.porter.parse.java.JavaTokenType;
import tuff.porter.parse.java.SourceText;
import tuff.porter.parse.java.TokenGrouper;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenInputStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads a run of modifier keywords and annotations, which may be empty.
 */
final class Modifiers {
	static final Set<String> KEYWORDS = Set.of(
			"public", "protected", "private", "static", "final", "abstract", "native", "synchronized",
			"transient", "volatile", "strictfp", "default");

	private Modifiers() {
		// utility class
	}

	static JavaModifiers read(TokenInputStream s) {
		List<String> keywords = new ArrayList<>();
		List<String> annotations = new ArrayList<>();
		while (s.hasNext()) {
			if (s.current() instanceof JavaToken t && t.type() == JavaTokenType.KEYWORD
					&& KEYWORDS.contains(t.lexeme())) {
				keywords.add(t.lexeme());
				s.advance();
				continue;
			}
			if (s.isPunctuation("@") && Syntax.isIdentAt(s, 1)) {
				annotations.add(readAnnotation(s));
				continue;
			}
			break;
		}
		if (keywords.isEmpty() && annotations.isEmpty()) {
			return JavaModifiers.NONE;
		}
		return new JavaModifiers(keywords, annotations);
	}

	private static String readAnnotation(TokenInputStream s) {
		TokenInputStream view = s.peekStream();
		s.advance();
		Syntax.qualifiedName(s);
		if (s.isGroup(GroupKind.ROUND)) {
			s.advance();
		}
		List<TokenElement> consumed = new ArrayList<>();
		while (view.position() < s.position()) {
			consumed.add(view.advance());
		}
		return SourceText.of(TokenGrouper.flatten(consumed));
	}
}
