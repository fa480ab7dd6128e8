package tuff.porter.ast.tuff;

public sealed interface TuffMember extends TuffNode permits TuffTypeAlias, TuffLetDecl, TuffFnDecl,
		TuffConstructorDecl, TuffInitDecl {
}
