package tuff.porter.ast.tuff;

import tuff.porter.ast.SourceSpan;

public record TuffInitDecl(boolean isStatic, String body, SourceSpan span) implements TuffMember {
}
