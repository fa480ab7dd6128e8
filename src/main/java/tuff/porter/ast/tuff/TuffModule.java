package tuff.porter.ast.tuff;

import tuff.porter.ast.SourceSpan;

import java.util.List;

public record TuffModule(List<TuffImportDecl> imports, List<TuffDecl> decls, SourceSpan span) implements TuffNode {
}
