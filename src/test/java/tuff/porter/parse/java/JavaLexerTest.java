package tuff.porter.parse.java;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class JavaLexerTest {
	@Test
	void emitsCommentsAsTokensButNotInsideStrings() {
		String input = "int x = 1; // line\n" +
				"/* block */ int y=2;\n" +
				"String s = \"/* not a comment */\"; // trailing\n";

		var tokens = new JavaLexer().lex(input);
		String lexemes = tokens.stream()
				.filter(t -> t.type() != JavaTokenType.EOF && t.type() != JavaTokenType.COMMENT)
				.map(JavaToken::lexeme)
				.collect(Collectors.joining("|"));

		assertEquals(
				"int|x|=|1|;|int|y|=|2|;|String|s|=|\"/* not a comment */\"|;",
				lexemes);
		assertEquals(3, tokens.stream().filter(t -> t.type() == JavaTokenType.COMMENT).count());
	}

	@Test
	void anglesAreAlwaysSingleTokens() {
		var tokens = new JavaLexer().lex("Map<String, List<Integer>> m; x >>= 2;");
		String lexemes = tokens.stream()
				.filter(t -> t.type() != JavaTokenType.EOF)
				.map(JavaToken::lexeme)
				.collect(Collectors.joining("|"));

		assertEquals("Map|<|String|,|List|<|Integer|>|>|m|;|x|>|>=|2|;", lexemes);
	}

	@Test
	void classifiesTokens() {
		var tokens = new JavaLexer().lex("@Override public void f(int... xs) { return 0x1Fl + .5e3 + 'c'; }");
		List<JavaTokenType> types = tokens.stream().map(JavaToken::type).toList();

		assertEquals(List.of(
				JavaTokenType.PUNCTUATION, JavaTokenType.IDENT, JavaTokenType.KEYWORD, JavaTokenType.KEYWORD,
				JavaTokenType.IDENT, JavaTokenType.PUNCTUATION, JavaTokenType.KEYWORD, JavaTokenType.PUNCTUATION,
				JavaTokenType.IDENT, JavaTokenType.PUNCTUATION, JavaTokenType.PUNCTUATION, JavaTokenType.KEYWORD,
				JavaTokenType.NUMBER, JavaTokenType.OPERATOR, JavaTokenType.NUMBER, JavaTokenType.OPERATOR,
				JavaTokenType.CHAR, JavaTokenType.PUNCTUATION, JavaTokenType.PUNCTUATION, JavaTokenType.EOF),
				types);
		assertEquals("0x1Fl", tokens.get(12).lexeme());
		assertEquals(".5e3", tokens.get(14).lexeme());
	}

	@Test
	void tracksLinesAndColumns() {
		var tokens = new JavaLexer().lex("class A {\n\tint x;\r\n}");

		JavaToken intToken = tokens.get(3);
		assertEquals("int", intToken.lexeme());
		assertEquals(2, intToken.line());
		assertEquals(2, intToken.column());

		JavaToken close = tokens.get(6);
		assertEquals("}", close.lexeme());
		assertEquals(3, close.line());
		assertEquals(1, close.column());
	}

	@Test
	void endsWithEof() {
		var tokens = new JavaLexer().lex("");
		assertEquals(1, tokens.size());
		assertEquals(JavaTokenType.EOF, tokens.get(0).type());
	}
}
