package tuff.porter.parse.java.match;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import tuff.porter.ast.java.JavaNode;
import tuff.porter.parse.java.JavaLexer;
import tuff.porter.parse.java.TokenGrouper;
import tuff.porter.parse.java.TokenInputStream;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * One minimal accepted and one minimal rejected input per matcher. Each accepted input must
 * also be claimed first by its own matcher when the whole priority list is tried in order.
 */
public class MatcherConformanceTest {
	private static final JavaMatchers MATCHERS = new JavaMatchers();

	static Stream<Arguments> examples() {
		return Stream.of(
				Arguments.of("field", "private int[] x = compute(1, 2);", "int f() {}"),
				Arguments.of("method", "public <T> List<T> m(T... xs) throws IOException { return null; }",
						"int x = f();"),
				Arguments.of("nested class", "static class B<T> extends C implements D, E {}", "static {}"),
				Arguments.of("static initializer", "static { x = 1; }", "{ x = 1; }"),
				Arguments.of("instance initializer", "{ x = 1; }", "static { }"),
				Arguments.of("constructor", "public A(final int x) throws E {}", "foo();"),
				Arguments.of("package", "package a.b;", "import a.b;"),
				Arguments.of("import", "import static a.b.C.*;", "package a.b;"),
				Arguments.of("type declaration", "@Deprecated public interface I extends J {}", "enum E {}"));
	}

	@ParameterizedTest(name = "{0} accepts {1}")
	@MethodSource("examples")
	void acceptsPositiveAndParsesToTheSameBoundary(String matcherName, String positive, String negative) {
		ConstructMatcher<? extends JavaNode> matcher = matcher(matcherName);
		TokenInputStream stream = stream(positive);

		TokenInputStream matching = stream.peekStream();
		assertTrue(matcher.isMatch(matching), matcherName + " should accept " + positive);
		assertFalse(matching.hasNext(), "isMatch should reach the end of " + positive);

		TokenInputStream parsing = stream.peekStream();
		assertNotNull(matcher.parse(parsing));
		assertEquals(matching.position(), parsing.position());
		assertEquals(0, stream.position());
	}

	@ParameterizedTest(name = "{0} rejects {2}")
	@MethodSource("examples")
	void rejectsNegative(String matcherName, String positive, String negative) {
		assertFalse(matcher(matcherName).isMatch(stream(negative).peekStream()),
				matcherName + " should reject " + negative);
	}

	@ParameterizedTest(name = "{0} wins priority for {1}")
	@MethodSource("examples")
	void positiveIsClaimedFirstByItsOwnMatcher(String matcherName, String positive, String negative) {
		List<ConstructMatcher<?>> ordered = new ArrayList<>(MATCHERS.classBody().matchers());
		if (!ordered.contains(matcher(matcherName))) {
			ordered = new ArrayList<>(MATCHERS.compilationUnit().matchers());
		}

		String first = null;
		for (ConstructMatcher<?> candidate : ordered) {
			if (candidate.isMatch(stream(positive))) {
				first = candidate.name();
				break;
			}
		}
		assertEquals(matcherName, first);
	}

	private static ConstructMatcher<? extends JavaNode> matcher(String name) {
		List<ConstructMatcher<? extends JavaNode>> all = new ArrayList<>();
		all.addAll(MATCHERS.classBody().matchers());
		all.addAll(MATCHERS.compilationUnit().matchers());
		return all.stream()
				.filter(m -> m.name().equals(name))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("No matcher named " + name));
	}

	private static TokenInputStream stream(String source) {
		return TokenInputStream.of(new TokenGrouper().group(new JavaLexer().lex(source)));
	}
}
