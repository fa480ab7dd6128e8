package tuff.porter.ast.tuff;

public sealed interface TuffDecl extends TuffNode permits TuffClassDecl {
	String name();
}
