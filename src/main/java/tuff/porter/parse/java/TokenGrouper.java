package tuff.porter.parse.java;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Collapses every matched bracket pair of a flat token list into a {@link TokenGroup}.
 *
 * Purely structural: content is never validated here. '{', '(' and '[' always open a
 * group. '<' opens one only when a bounded look-ahead finds its matching '>' with
 * nothing but type-argument tokens in between; otherwise it stays an operator.
 */
public final class TokenGrouper {
	private static final Set<String> TYPE_ARGUMENT_KEYWORDS = Set.of(
			"extends", "super", "boolean", "byte", "char", "short", "int", "long", "float", "double", "void");

	public List<TokenElement> group(List<JavaToken> tokens) {
		Deque<Frame> stack = new ArrayDeque<>();
		List<TokenElement> top = new ArrayList<>();

		for (int i = 0; i < tokens.size(); i++) {
			JavaToken t = tokens.get(i);
			if (t.type() == JavaTokenType.EOF) {
				break;
			}
			List<TokenElement> target = stack.isEmpty() ? top : stack.peek().children;

			GroupKind opening = GroupKind.forOpen(t);
			if (opening == null && t.isOperator("<") && opensTypeArguments(tokens, i)) {
				opening = GroupKind.ANGLE;
			}
			if (opening != null) {
				stack.push(new Frame(opening, t));
				continue;
			}

			GroupKind closing = GroupKind.forClose(t);
			if (closing == null && t.isOperator(">") && !stack.isEmpty() && stack.peek().kind == GroupKind.ANGLE) {
				closing = GroupKind.ANGLE;
			}
			if (closing != null) {
				if (stack.isEmpty()) {
					throw new UnbalancedBracketException("Unmatched '" + t.lexeme() + "'", t);
				}
				Frame frame = stack.pop();
				if (frame.kind != closing) {
					throw new UnbalancedBracketException("Expected '" + frame.kind.close() + "' to close '"
							+ frame.open.lexeme() + "' opened at " + frame.open.line() + ":" + frame.open.column()
							+ " but found '" + t.lexeme() + "'", t);
				}
				TokenGroup group = new TokenGroup(frame.kind, frame.open, t, frame.children);
				(stack.isEmpty() ? top : stack.peek().children).add(group);
				continue;
			}

			target.add(t);
		}

		if (!stack.isEmpty()) {
			Frame innermost = stack.peek();
			throw new UnbalancedBracketException("Unclosed '" + innermost.open.lexeme() + "'", innermost.open);
		}
		return List.copyOf(top);
	}

	/**
	 * Depth-first reverse of {@link #group(List)}: bracket tokens are emitted around
	 * their children.
	 */
	public static List<JavaToken> flatten(List<TokenElement> elements) {
		List<JavaToken> out = new ArrayList<>();
		flattenInto(elements, out);
		return out;
	}

	private static void flattenInto(List<TokenElement> elements, List<JavaToken> out) {
		for (TokenElement element : elements) {
			if (element instanceof JavaToken token) {
				out.add(token);
			} else if (element instanceof TokenGroup group) {
				out.add(group.open());
				flattenInto(group.children(), out);
				out.add(group.close());
			}
		}
	}

	private static boolean opensTypeArguments(List<JavaToken> tokens, int start) {
		int depth = 0;
		int squareDepth = 0;
		for (int i = start; i < tokens.size(); i++) {
			JavaToken t = tokens.get(i);
			if (t.isOperator("<")) {
				depth++;
				continue;
			}
			if (t.isOperator(">")) {
				// a '>' inside brackets belongs to an index expression, not to a type
				if (squareDepth > 0) {
					return false;
				}
				depth--;
				if (depth == 0) {
					return true;
				}
				continue;
			}
			if (t.isPunctuation("[")) {
				squareDepth++;
				continue;
			}
			if (t.isPunctuation("]")) {
				if (--squareDepth < 0) {
					return false;
				}
				continue;
			}
			if (t.isPunctuation("@")) {
				int end = skipAnnotation(tokens, i);
				if (end < 0) {
					return false;
				}
				i = end;
				continue;
			}
			if (!isTypeArgumentToken(t)) {
				return false;
			}
		}
		return false;
	}

	/**
	 * Index of the last token of the annotation starting at {@code at}: its dotted name and
	 * an optional balanced argument list. -1 if the arguments never close.
	 */
	private static int skipAnnotation(List<JavaToken> tokens, int at) {
		int i = at + 1;
		while (i < tokens.size() && (tokens.get(i).type() == JavaTokenType.IDENT || tokens.get(i).isPunctuation("."))) {
			i++;
		}
		if (i >= tokens.size() || !tokens.get(i).isPunctuation("(")) {
			return i - 1;
		}
		int parens = 0;
		for (; i < tokens.size(); i++) {
			JavaToken t = tokens.get(i);
			if (t.isPunctuation("(")) {
				parens++;
			} else if (t.isPunctuation(")")) {
				if (--parens == 0) {
					return i;
				}
			} else if (t.isPunctuation(";") || t.isPunctuation("{") || t.isPunctuation("}")
					|| t.type() == JavaTokenType.EOF) {
				return -1;
			}
		}
		return -1;
	}

	private static boolean isTypeArgumentToken(JavaToken t) {
		return switch (t.type()) {
			case IDENT -> true;
			case KEYWORD -> TYPE_ARGUMENT_KEYWORDS.contains(t.lexeme());
			case PUNCTUATION -> t.lexeme().equals(",") || t.lexeme().equals(".");
			case OPERATOR -> t.lexeme().equals("?") || t.lexeme().equals("&");
			default -> false;
		};
	}

	private static final class Frame {
		private final GroupKind kind;
		private final JavaToken open;
		private final List<TokenElement> children = new ArrayList<>();

		Frame(GroupKind kind, JavaToken open) {
			this.kind = kind;
			this.open = open;
		}
	}
}
