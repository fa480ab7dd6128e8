package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

import java.util.List;

public record JavaConstructorDecl(
		JavaModifiers modifiers,
		List<JavaTypeParameter> typeParameters,
		String name,
		List<JavaParam> params,
		List<JavaTypeRef> throwsTypes,
		JavaOpaqueBody body,
		SourceSpan span) implements JavaMemberDecl {
}
