package tuff.porter.parse.java.match;

import tuff.porter.ast.SourceSpan;
import tuff.porter.parse.java.JavaToken;
import tuff.porter.parse.java.JavaTokenType;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenGroup;
import tuff.porter.parse.java.TokenInputStream;

/**
 * Small scanning primitives shared by every matcher. Each either consumes what it reads or
 * returns null/false; none of them throws on unexpected input.
 */
final class Syntax {
	private Syntax() {
		// utility class
	}

	static JavaToken ident(TokenInputStream s) {
		if (!s.isIdent()) {
			return null;
		}
		return (JavaToken) s.advance();
	}

	static boolean acceptKeyword(TokenInputStream s, String keyword) {
		if (!s.isKeyword(keyword)) {
			return false;
		}
		s.advance();
		return true;
	}

	static boolean acceptPunctuation(TokenInputStream s, String symbol) {
		if (!s.isPunctuation(symbol)) {
			return false;
		}
		s.advance();
		return true;
	}

	static boolean isIdentAt(TokenInputStream s, int ahead) {
		return s.peek(ahead).filter(e -> e instanceof JavaToken t && t.type() == JavaTokenType.IDENT).isPresent();
	}

	/**
	 * IDENT ('.' IDENT)*
	 */
	static String qualifiedName(TokenInputStream s) {
		JavaToken first = ident(s);
		if (first == null) {
			return null;
		}
		StringBuilder name = new StringBuilder(first.lexeme());
		while (s.isPunctuation(".") && isIdentAt(s, 1)) {
			s.advance();
			name.append('.').append(((JavaToken) s.advance()).lexeme());
		}
		return name.toString();
	}

	/**
	 * Consumes elements up to and including the next ';' at this level. At least one element
	 * must precede the ';'.
	 */
	static boolean skipToSemicolon(TokenInputStream s) {
		boolean any = false;
		while (s.hasNext()) {
			if (s.isPunctuation(";")) {
				s.advance();
				return any;
			}
			s.advance();
			any = true;
		}
		return false;
	}

	static TokenGroup group(TokenInputStream s) {
		return (TokenGroup) s.advance();
	}

	static SourceSpan spanFrom(TokenElement start, TokenInputStream s) {
		return start.span().to(s.previous().span());
	}

	/**
	 * For use in {@code parse}: whatever {@code isMatch} accepted must read again.
	 */
	static <T> T require(T value, TokenInputStream s, String what) {
		if (value == null) {
			throw unreadable(s, what);
		}
		return value;
	}

	static void requirePunctuation(TokenInputStream s, String symbol) {
		if (!acceptPunctuation(s, symbol)) {
			throw unreadable(s, "'" + symbol + "'");
		}
	}

	static void requireKeyword(TokenInputStream s, String keyword) {
		if (!acceptKeyword(s, keyword)) {
			throw unreadable(s, "'" + keyword + "'");
		}
	}

	private static MatcherConsumptionMismatchException unreadable(TokenInputStream s, String what) {
		TokenElement at = s.hasNext() ? s.current() : s.previous();
		return new MatcherConsumptionMismatchException("Could not read " + what + " after a successful match", at);
	}
}
