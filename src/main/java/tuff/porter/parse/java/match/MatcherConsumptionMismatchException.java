package tuff.porter.parse.java.match;

import tuff.porter.ErrorKind;
import tuff.porter.TranspileException;
import tuff.porter.parse.java.TokenElement;

/**
 * A matcher's {@code parse} disagreed with its own {@code isMatch}. Always a defect in the
 * matcher, never a problem with the input.
 */
public class MatcherConsumptionMismatchException extends TranspileException {
	public MatcherConsumptionMismatchException(String what, TokenElement element) {
		super(ErrorKind.MATCHER_CONSUMPTION_MISMATCH, what, element.firstToken().line(),
				element.firstToken().column(), element.text());
	}

	static MatcherConsumptionMismatchException endMismatch(ConstructMatcher<?> matcher, TokenElement start,
			int expectedEnd, int actualEnd) {
		return new MatcherConsumptionMismatchException("Matcher '" + matcher.name() + "' matched up to element "
				+ expectedEnd + " but parsed up to element " + actualEnd, start);
	}

	static MatcherConsumptionMismatchException emptyMatch(ConstructMatcher<?> matcher, TokenElement start) {
		return new MatcherConsumptionMismatchException("Matcher '" + matcher.name() + "' matched without consuming",
				start);
	}
}
