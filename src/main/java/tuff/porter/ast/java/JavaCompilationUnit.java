package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

import java.util.List;

/**
 * One source file. {@code packageDecl} is null for the default package.
 */
public record JavaCompilationUnit(
		JavaPackageDecl packageDecl,
		List<JavaImportDecl> imports,
		List<JavaClassDecl> types,
		SourceSpan span) implements JavaNode {
}
