package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaNode;
import tuff.porter.parse.java.TokenInputStream;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives an ordered list of matchers over the direct children of one body. The first
 * matcher whose {@code isMatch} succeeds wins; nothing is retried.
 */
public final class BodyDispatcher<T extends JavaNode> {
	private final List<ConstructMatcher<? extends T>> matchers;

	public BodyDispatcher(List<ConstructMatcher<? extends T>> matchers) {
		this.matchers = List.copyOf(matchers);
	}

	public List<ConstructMatcher<? extends T>> matchers() {
		return matchers;
	}

	public List<T> dispatch(TokenInputStream stream) {
		List<T> nodes = new ArrayList<>();
		while (stream.hasNext()) {
			nodes.add(next(stream));
		}
		return List.copyOf(nodes);
	}

	/**
	 * Parses exactly one construct at the cursor and advances past it.
	 */
	public T next(TokenInputStream stream) {
		for (ConstructMatcher<? extends T> matcher : matchers) {
			TokenInputStream trial = stream.peekStream();
			if (!matcher.isMatch(trial)) {
				continue;
			}
			if (trial.position() == stream.position()) {
				throw MatcherConsumptionMismatchException.emptyMatch(matcher, stream.current());
			}

			TokenInputStream parsing = stream.peekStream();
			T node = matcher.parse(parsing);
			if (parsing.position() != trial.position()) {
				throw MatcherConsumptionMismatchException.endMismatch(matcher, stream.current(), trial.position(),
						parsing.position());
			}
			stream.commit(parsing);
			return node;
		}
		throw new UnrecognizedMemberException(stream.current());
	}
}
