package tuff.porter.ast.java;

public sealed interface JavaExpr extends JavaNode permits JavaAnonymousClassExpr, JavaOpaqueExpr {
}
