package tuff.porter.parse.java;

import tuff.porter.ast.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lexer for the Java subset supported by this project.
 *
 * Notes:
 * - Skips whitespace.
 * - Emits // line comments and /* block comments *\/ as COMMENT tokens.
 * - Does NOT implement Java text blocks ("""..."""); triple quotes will be
 * tokenized as regular strings.
 * - '<' and '>' are always single tokens, so that nested type arguments can be
 * grouped; shifts come out as two tokens.
 */
public final class JavaLexer {
	static final Set<String> KEYWORDS = Set.of(
			"abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
			"continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
			"for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
			"new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
			"super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
			"volatile", "while", "true", "false", "null");

	private static final List<String> MULTI_CHAR_OPERATORS = List.of(
			"...", "->", "::", "==", "!=", "<=", ">=", "&&", "||", "++", "--",
			"+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=");

	private static final String PUNCTUATION = "(){}[];,.@";

	public List<JavaToken> lex(String input) {
		List<JavaToken> tokens = new ArrayList<>();
		LineMap lines = new LineMap(input);
		int i = 0;
		while (i < input.length()) {
			char c = input.charAt(i);

			// whitespace
			if (Character.isWhitespace(c)) {
				i++;
				continue;
			}

			int start = i;

			// comments (must be checked before operators)
			if (c == '/' && i + 1 < input.length()) {
				char n = input.charAt(i + 1);
				if (n == '/') {
					i = consumeLineComment(input, i);
					tokens.add(token(JavaTokenType.COMMENT, input, start, i, lines));
					continue;
				}
				if (n == '*') {
					i = consumeBlockComment(input, i);
					tokens.add(token(JavaTokenType.COMMENT, input, start, i, lines));
					continue;
				}
			}

			// string literal
			if (c == '"') {
				i = consumeQuoted(input, i, '"');
				tokens.add(token(JavaTokenType.STRING, input, start, i, lines));
				continue;
			}

			// char literal
			if (c == '\'') {
				i = consumeQuoted(input, i, '\'');
				tokens.add(token(JavaTokenType.CHAR, input, start, i, lines));
				continue;
			}

			// identifier or keyword
			if (Character.isJavaIdentifierStart(c)) {
				i++;
				while (i < input.length() && Character.isJavaIdentifierPart(input.charAt(i))) {
					i++;
				}
				String word = input.substring(start, i);
				JavaTokenType type = KEYWORDS.contains(word) ? JavaTokenType.KEYWORD : JavaTokenType.IDENT;
				tokens.add(token(type, input, start, i, lines));
				continue;
			}

			// number, including ".5"
			if (Character.isDigit(c) || (c == '.' && i + 1 < input.length() && Character.isDigit(input.charAt(i + 1)))) {
				i = consumeNumber(input, i);
				tokens.add(token(JavaTokenType.NUMBER, input, start, i, lines));
				continue;
			}

			// multi-char operators
			String op = matchOperator(input, i);
			if (op != null) {
				i += op.length();
				JavaTokenType type = op.equals("...") ? JavaTokenType.PUNCTUATION : JavaTokenType.OPERATOR;
				tokens.add(token(type, input, start, i, lines));
				continue;
			}

			// single-char symbol
			i++;
			JavaTokenType type = PUNCTUATION.indexOf(c) >= 0 ? JavaTokenType.PUNCTUATION : JavaTokenType.OPERATOR;
			tokens.add(token(type, input, start, i, lines));
		}

		tokens.add(token(JavaTokenType.EOF, input, input.length(), input.length(), lines));
		return tokens;
	}

	private static JavaToken token(JavaTokenType type, String input, int start, int end, LineMap lines) {
		return new JavaToken(type, input.substring(start, end),
				new SourceSpan(start, end, lines.lineOf(start), lines.columnOf(start)));
	}

	private static String matchOperator(String input, int i) {
		for (String op : MULTI_CHAR_OPERATORS) {
			if (input.startsWith(op, i)) {
				return op;
			}
		}
		return null;
	}

	private static int consumeNumber(String input, int start) {
		int i = start;
		if (input.startsWith("0x", i) || input.startsWith("0X", i) || input.startsWith("0b", i)
				|| input.startsWith("0B", i)) {
			i += 2;
			while (i < input.length() && (Character.isLetterOrDigit(input.charAt(i)) || input.charAt(i) == '_')) {
				i++;
			}
			return i;
		}
		while (i < input.length()) {
			char c = input.charAt(i);
			if (Character.isDigit(c) || c == '_') {
				i++;
				continue;
			}
			if (c == '.' && i + 1 < input.length() && Character.isDigit(input.charAt(i + 1))) {
				i++;
				continue;
			}
			if ((c == 'e' || c == 'E') && i + 1 < input.length()) {
				char n = input.charAt(i + 1);
				if (Character.isDigit(n) || n == '+' || n == '-') {
					i += 2;
					continue;
				}
			}
			break;
		}
		if (i < input.length() && "lLfFdD".indexOf(input.charAt(i)) >= 0) {
			i++;
		}
		return i;
	}

	private static int consumeLineComment(String input, int start) {
		int i = start + 2;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\n' || c == '\r') {
				return i;
			}
			i++;
		}
		return i;
	}

	private static int consumeBlockComment(String input, int start) {
		int i = start + 2;
		while (i < input.length()) {
			if (input.charAt(i) == '*' && i + 1 < input.length() && input.charAt(i + 1) == '/') {
				return i + 2;
			}
			i++;
		}
		return i;
	}

	private static int consumeQuoted(String input, int start, char quote) {
		int i = start + 1;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\\') {
				// skip escaped character if present
				i = Math.min(i + 2, input.length());
				continue;
			}
			if (c == quote) {
				return i + 1;
			}
			i++;
		}
		return i;
	}

	/**
	 * Offset to line/column translation, built once per input.
	 */
	private static final class LineMap {
		private final List<Integer> lineStarts = new ArrayList<>();

		LineMap(String input) {
			lineStarts.add(0);
			for (int i = 0; i < input.length(); i++) {
				char c = input.charAt(i);
				if (c == '\n') {
					lineStarts.add(i + 1);
				} else if (c == '\r' && (i + 1 >= input.length() || input.charAt(i + 1) != '\n')) {
					lineStarts.add(i + 1);
				}
			}
		}

		int lineOf(int offset) {
			int lo = 0;
			int hi = lineStarts.size() - 1;
			while (lo < hi) {
				int mid = (lo + hi + 1) >>> 1;
				if (lineStarts.get(mid) <= offset) {
					lo = mid;
				} else {
					hi = mid - 1;
				}
			}
			return lo + 1;
		}

		int columnOf(int offset) {
			return offset - lineStarts.get(lineOf(offset) - 1) + 1;
		}
	}
}
