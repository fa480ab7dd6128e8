package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

import java.util.List;

/**
 * {@code body} is null for abstract and interface methods declared with ';'.
 */
public record JavaMethodDecl(
		JavaModifiers modifiers,
		List<JavaTypeParameter> typeParameters,
		JavaTypeRef returnType,
		String name,
		List<JavaParam> params,
		List<JavaTypeRef> throwsTypes,
		JavaOpaqueBody body,
		SourceSpan span) implements JavaMemberDecl {
	public boolean hasBody() {
		return body != null;
	}
}
