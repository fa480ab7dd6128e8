package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

public record JavaInstanceInitializer(JavaOpaqueBody body, SourceSpan span) implements JavaMemberDecl {
}
