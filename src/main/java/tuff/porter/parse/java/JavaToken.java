package tuff.porter.parse.java;

import tuff.porter.ast.SourceSpan;

public record JavaToken(JavaTokenType type, String lexeme, SourceSpan span) implements TokenElement {

	public boolean is(JavaTokenType type, String lexeme) {
		return this.type == type && this.lexeme.equals(lexeme);
	}

	public boolean isKeyword(String keyword) {
		return is(JavaTokenType.KEYWORD, keyword);
	}

	public boolean isPunctuation(String symbol) {
		return is(JavaTokenType.PUNCTUATION, symbol);
	}

	public boolean isOperator(String symbol) {
		return is(JavaTokenType.OPERATOR, symbol);
	}

	public int line() {
		return span.line();
	}

	public int column() {
		return span.column();
	}

	@Override
	public JavaToken firstToken() {
		return this;
	}

	@Override
	public String text() {
		return lexeme;
	}
}
