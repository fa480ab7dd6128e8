package tuff.porter.transform;

import tuff.porter.ErrorKind;
import tuff.porter.TranspileException;
import tuff.porter.ast.SourceSpan;

/**
 * A reference that could not be resolved while lowering. Carries the missing symbol.
 */
public class EmissionException extends TranspileException {
	private final String symbol;

	public EmissionException(String what, String symbol, SourceSpan span) {
		super(ErrorKind.EMISSION, what, span.line(), span.column(), symbol);
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
