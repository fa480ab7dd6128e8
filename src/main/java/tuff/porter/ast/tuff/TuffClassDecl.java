package tuff.porter.ast.tuff;

import tuff.porter.ast.SourceSpan;

import java.util.List;

/**
 * A top-level Tuff declaration. Nested and anonymous Java classes arrive here already
 * hoisted; the enclosing declaration lists them as {@link TuffTypeAlias} members.
 *
 * For an interface, {@code superTypes} holds the extended interfaces and
 * {@code interfaces} is empty.
 */
public record TuffClassDecl(
		boolean isInterface,
		String name,
		List<String> typeParameters,
		List<String> superTypes,
		List<String> interfaces,
		List<TuffMember> members,
		SourceSpan span) implements TuffDecl {
}
