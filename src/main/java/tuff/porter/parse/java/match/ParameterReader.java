package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaModifiers;
import tuff.porter.ast.java.JavaParam;
import tuff.porter.ast.java.JavaTypeRef;
import tuff.porter.parse.java.GroupKind;
import tuff.porter.parse.java.JavaToken;
import tuff.porter.parse.java.TokenElement;
import tuff.porter.parse.java.TokenInputStream;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the round group at the cursor as a formal parameter list.
 */
final class ParameterReader {
	private ParameterReader() {
		// utility class
	}

	/**
	 * Returns null when the cursor is not on a well-formed parameter list.
	 */
	static List<JavaParam> readParameters(TokenInputStream s) {
		if (!s.isGroup(GroupKind.ROUND)) {
			return null;
		}
		TokenInputStream in = s.subStreamForCurrentGroup();
		s.advance();

		List<JavaParam> params = new ArrayList<>();
		while (in.hasNext()) {
			TokenElement start = in.current();
			JavaModifiers modifiers = Modifiers.read(in);
			JavaTypeRef type = TypeReader.readType(in);
			if (type == null) {
				return null;
			}
			boolean varargs = Syntax.acceptPunctuation(in, "...");
			JavaToken name = Syntax.ident(in);
			if (name == null) {
				return null;
			}
			type = TypeReader.readDimensions(in, type);
			params.add(new JavaParam(modifiers, type, name.lexeme(), varargs, Syntax.spanFrom(start, in)));

			if (in.hasNext() && (!Syntax.acceptPunctuation(in, ",") || !in.hasNext())) {
				return null;
			}
		}
		return List.copyOf(params);
	}
}
