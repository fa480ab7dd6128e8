package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

import java.util.List;

/**
 * {@code new Base(arguments) { members }}. The base type is kept by name; it is resolved
 * only when the expression is lowered.
 */
public record JavaAnonymousClassExpr(
		JavaTypeRef baseType,
		JavaGroupFragment arguments,
		List<JavaMemberDecl> members,
		SourceSpan span) implements JavaExpr, JavaFragment {
}
