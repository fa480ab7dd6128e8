package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

public sealed interface JavaNode permits JavaCompilationUnit, JavaPackageDecl, JavaImportDecl, JavaClassDecl,
		JavaMemberDecl, JavaParam, JavaTypeParameter, JavaOpaqueBody, JavaExpr, JavaFragment, JavaTypeRef {
	SourceSpan span();
}
