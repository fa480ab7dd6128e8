package tuff.porter.ast.java;

public enum JavaTypeKind {
	CLASS,
	INTERFACE
}
