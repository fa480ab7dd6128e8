package tuff.porter;

/**
 * Base class of every error that stops a file from being transpiled.
 *
 * All subclasses point at the single token or group responsible; none of them is
 * recoverable for the file being processed.
 */
public abstract class TranspileException extends RuntimeException {
	private final ErrorKind kind;
	private final int line;
	private final int column;
	private final String offendingText;

	protected TranspileException(ErrorKind kind, String what, int line, int column, String offendingText) {
		super(what + " at " + line + ":" + column + ": " + offendingText);
		this.kind = kind;
		this.line = line;
		this.column = column;
		this.offendingText = offendingText;
	}

	public ErrorKind kind() {
		return kind;
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}

	public String offendingText() {
		return offendingText;
	}

	public TranspileFailure toFailure() {
		return new TranspileFailure(kind, line, column, offendingText, getMessage());
	}
}
