package tuff.porter.parse.java;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenInputStreamTest {
	@Test
	void peekStreamDoesNotMoveTheOriginal() {
		TokenInputStream s = stream("int x ;");

		TokenInputStream trial = s.peekStream();
		trial.advance();
		trial.advance();

		assertEquals(0, s.position());
		assertEquals(2, trial.position());
		assertTrue(s.isKeyword("int"));
	}

	@Test
	void commitMovesToTheDerivedPosition() {
		TokenInputStream s = stream("int x ;");
		TokenInputStream trial = s.peekStream();
		trial.advance();
		trial.advance();

		s.commit(trial);

		assertEquals(2, s.position());
		assertTrue(s.isPunctuation(";"));
	}

	@Test
	void commitRejectsForeignAndBackwardStreams() {
		TokenInputStream s = stream("int x ;");
		TokenInputStream earlier = s.peekStream();
		s.advance();

		assertThrows(IllegalArgumentException.class, () -> s.commit(stream("int x ;")));
		assertThrows(IllegalArgumentException.class, () -> s.commit(earlier));
	}

	@Test
	void peekLooksAheadWithoutConsuming() {
		TokenInputStream s = stream("a b c");

		assertEquals("a", s.peek(0).orElseThrow().text());
		assertEquals("b", s.peek().orElseThrow().text());
		assertEquals("c", s.peek(2).orElseThrow().text());
		assertFalse(s.peek(3).isPresent());
		assertEquals(0, s.position());
	}

	@Test
	void subStreamCoversTheGroupInterior() {
		TokenInputStream s = stream("f(a, b) ;");
		s.advance();

		assertTrue(s.isGroup(GroupKind.ROUND));
		TokenInputStream inner = s.subStreamForCurrentGroup();

		assertEquals(3, inner.remaining().size());
		assertTrue(inner.isIdent());
		assertEquals(1, s.position());
		assertThrows(IllegalStateException.class, () -> stream("x").subStreamForCurrentGroup());
	}

	@Test
	void currentFailsAtTheEnd() {
		TokenInputStream s = stream("x");
		s.advance();

		assertFalse(s.hasNext());
		assertThrows(NoSuchElementException.class, s::current);
		assertEquals("x", s.previous().text());
	}

	private static TokenInputStream stream(String source) {
		List<TokenElement> elements = new TokenGrouper().group(new JavaLexer().lex(source));
		return TokenInputStream.of(elements);
	}
}
