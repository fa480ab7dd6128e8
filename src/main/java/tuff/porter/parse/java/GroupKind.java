package tuff.porter.parse.java;

public enum GroupKind {
	CURLY("{", "}"),
	ROUND("(", ")"),
	SQUARE("[", "]"),
	ANGLE("<", ">");

	private final String open;
	private final String close;

	GroupKind(String open, String close) {
		this.open = open;
		this.close = close;
	}

	public String open() {
		return open;
	}

	public String close() {
		return close;
	}

	static GroupKind forOpen(JavaToken token) {
		for (GroupKind kind : values()) {
			if (kind != ANGLE && token.isPunctuation(kind.open)) {
				return kind;
			}
		}
		return null;
	}

	static GroupKind forClose(JavaToken token) {
		for (GroupKind kind : values()) {
			if (kind != ANGLE && token.isPunctuation(kind.close)) {
				return kind;
			}
		}
		return null;
	}
}
