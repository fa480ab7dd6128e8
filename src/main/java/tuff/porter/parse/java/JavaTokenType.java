package tuff.porter.parse.java;

public enum JavaTokenType {
	KEYWORD,
	IDENT,
	NUMBER,
	STRING,
	CHAR,
	OPERATOR,
	PUNCTUATION,
	COMMENT,
	EOF
}
