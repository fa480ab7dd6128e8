package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

import java.util.List;

/**
 * A class or interface declaration. A class has at most one entry in {@code extendsTypes}.
 */
public record JavaClassDecl(
		JavaModifiers modifiers,
		JavaTypeKind kind,
		String name,
		List<JavaTypeParameter> typeParameters,
		List<JavaTypeRef> extendsTypes,
		List<JavaTypeRef> implementsTypes,
		List<JavaMemberDecl> members,
		SourceSpan span) implements JavaNode {
}
