package tuff.porter;

public enum ErrorKind {
	UNBALANCED_BRACKET,
	UNRECOGNIZED_MEMBER,
	MATCHER_CONSUMPTION_MISMATCH,
	EMISSION
}
