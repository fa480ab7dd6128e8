package tuff.porter;

/**
 * Structured description of why a file was not transpiled.
 */
public record TranspileFailure(ErrorKind kind, int line, int column, String offendingText, String message) {
	@Override
	public String toString() {
		return kind + " at " + line + ":" + column + ": " + offendingText;
	}
}
