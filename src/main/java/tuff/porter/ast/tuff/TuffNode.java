package tuff.porter.ast.tuff;

import tuff.porter.ast.SourceSpan;

public sealed interface TuffNode permits TuffModule, TuffImportDecl, TuffDecl, TuffMember {
	SourceSpan span();
}
