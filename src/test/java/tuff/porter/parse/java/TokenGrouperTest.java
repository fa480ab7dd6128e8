package tuff.porter.parse.java;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenGrouperTest {
	@Test
	void flattenRestoresTheTokenSequence() {
		String input = "class A<T extends Map<K, V>> { int[] f(List<? super T> xs) { if (a < b) { x = y >> 2; } } }";
		List<JavaToken> tokens = new JavaLexer().lex(input);

		List<TokenElement> grouped = new TokenGrouper().group(tokens);

		assertEquals(tokens.subList(0, tokens.size() - 1), TokenGrouper.flatten(grouped));
	}

	@Test
	void groupsClassBodyAsSingleElement() {
		List<TokenElement> grouped = group("class A { class B { void m() {} } }");

		assertEquals(3, grouped.size());
		TokenGroup body = assertInstanceOf(TokenGroup.class, grouped.get(2));
		assertEquals(GroupKind.CURLY, body.kind());
		assertEquals(3, body.children().size());
		TokenGroup inner = assertInstanceOf(TokenGroup.class, body.children().get(2));
		assertEquals("{ void m() {} }", inner.text());
	}

	@Test
	void groupsNestedTypeArguments() {
		List<TokenElement> grouped = group("Map<String, List<Integer>> m;");

		TokenGroup outer = assertInstanceOf(TokenGroup.class, grouped.get(1));
		assertEquals(GroupKind.ANGLE, outer.kind());
		TokenGroup inner = assertInstanceOf(TokenGroup.class, outer.children().get(3));
		assertEquals(GroupKind.ANGLE, inner.kind());
		assertEquals("<Integer>", inner.text());
	}

	@Test
	void comparisonsStayOperators() {
		List<TokenElement> grouped = group("a < b && c > d;");

		assertEquals(8, grouped.size());
		assertTrue(grouped.stream().allMatch(e -> e instanceof JavaToken));
	}

	@Test
	void shiftInsideIndexDoesNotCloseTypeArguments() {
		List<TokenElement> grouped = group("if (n < a[n >> 1]) {}");

		TokenGroup condition = assertInstanceOf(TokenGroup.class, grouped.get(1));
		assertEquals(GroupKind.ROUND, condition.kind());
		assertEquals(4, condition.children().size());
		assertInstanceOf(JavaToken.class, condition.children().get(1));
		TokenGroup index = assertInstanceOf(TokenGroup.class, condition.children().get(3));
		assertEquals(GroupKind.SQUARE, index.kind());
		assertEquals("[n >> 1]", index.text());
	}

	@Test
	void annotationArgumentsInsideTypeArguments() {
		List<TokenElement> grouped = group("List<@Ann(\"x\") String> xs;");

		TokenGroup arguments = assertInstanceOf(TokenGroup.class, grouped.get(1));
		assertEquals(GroupKind.ANGLE, arguments.kind());
		assertEquals("<@Ann(\"x\") String>", arguments.text());
	}

	@Test
	void reportsUnclosedBraceAtItsPosition() {
		var ex = assertThrows(UnbalancedBracketException.class, () -> group("class A {\n\tvoid m() {\n}"));

		assertEquals("{", ex.token().lexeme());
		assertEquals(1, ex.line());
		assertEquals(9, ex.column());
	}

	@Test
	void reportsInnermostUnclosedOpen() {
		var ex = assertThrows(UnbalancedBracketException.class, () -> group("class A { void m() { x("));

		assertEquals("(", ex.token().lexeme());
		assertEquals(23, ex.column());
	}

	@Test
	void reportsMismatchedCloseAtTheCloseToken() {
		var ex = assertThrows(UnbalancedBracketException.class, () -> group("class A { f(] }"));

		assertEquals("]", ex.token().lexeme());
		assertEquals(13, ex.column());
		assertTrue(ex.getMessage().startsWith("Expected ')' to close '(' opened at 1:12"), ex.getMessage());
	}

	@Test
	void reportsStrayClose() {
		var ex = assertThrows(UnbalancedBracketException.class, () -> group("int x; }"));

		assertEquals("}", ex.offendingText());
		assertEquals(8, ex.column());
	}

	private static List<TokenElement> group(String source) {
		return new TokenGrouper().group(new JavaLexer().lex(source));
	}
}
