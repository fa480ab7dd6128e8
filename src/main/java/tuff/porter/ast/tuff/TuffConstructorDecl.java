package tuff.porter.ast.tuff;

import tuff.porter.ast.SourceSpan;

import java.util.List;

public record TuffConstructorDecl(List<String> typeParameters, List<TuffParam> params, String body, SourceSpan span)
		implements TuffMember {
}
