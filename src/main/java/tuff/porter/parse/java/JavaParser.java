package tuff.porter.parse.java;

import tuff.porter.ast.SourceSpan;
import tuff.porter.ast.java.JavaClassDecl;
import tuff.porter.ast.java.JavaCompilationUnit;
import tuff.porter.ast.java.JavaImportDecl;
import tuff.porter.ast.java.JavaNode;
import tuff.porter.ast.java.JavaPackageDecl;
import tuff.porter.parse.java.match.JavaMatchers;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the member-declaration subset of Java.
 *
 * lex -> drop comments -> group brackets -> dispatch matchers over the top level. Method
 * and initializer bodies stay opaque.
 */
public final class JavaParser {
	private final JavaMatchers matchers = new JavaMatchers();

	public JavaCompilationUnit parse(String source) {
		List<JavaToken> tokens = new JavaLexer().lex(source).stream()
				.filter(t -> t.type() != JavaTokenType.COMMENT)
				.toList();
		List<TokenElement> elements = new TokenGrouper().group(tokens);
		List<JavaNode> nodes = matchers.compilationUnit().dispatch(TokenInputStream.of(elements));

		JavaPackageDecl packageDecl = null;
		List<JavaImportDecl> imports = new ArrayList<>();
		List<JavaClassDecl> types = new ArrayList<>();
		for (JavaNode node : nodes) {
			if (node instanceof JavaPackageDecl pkg && packageDecl == null) {
				packageDecl = pkg;
			} else if (node instanceof JavaImportDecl imp) {
				imports.add(imp);
			} else if (node instanceof JavaClassDecl clazz) {
				types.add(clazz);
			}
		}

		return new JavaCompilationUnit(packageDecl, List.copyOf(imports), List.copyOf(types),
				new SourceSpan(0, source.length(), 1, 1));
	}
}
