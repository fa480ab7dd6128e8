package tuff.porter.ast.java;

public sealed interface JavaTypeRef extends JavaNode permits JavaIdentType, JavaParameterizedType, JavaArrayType,
		JavaWildcardType {
}
