package tuff.porter.ast.java;

public sealed interface JavaMemberDecl extends JavaNode permits JavaFieldDecl, JavaMethodDecl, JavaConstructorDecl,
		JavaNestedClassDecl, JavaStaticInitializer, JavaInstanceInitializer {
}
