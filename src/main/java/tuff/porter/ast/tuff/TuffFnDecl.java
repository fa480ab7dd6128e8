package tuff.porter.ast.tuff;

import tuff.porter.ast.SourceSpan;

import java.util.List;

/**
 * {@code body} is the rendered block, or null for a declaration without one.
 */
public record TuffFnDecl(
		boolean isStatic,
		boolean isAbstract,
		String name,
		List<String> typeParameters,
		List<TuffParam> params,
		String returnType,
		String body,
		SourceSpan span) implements TuffMember {
}
