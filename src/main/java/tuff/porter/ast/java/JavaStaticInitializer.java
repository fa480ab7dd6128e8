package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

public record JavaStaticInitializer(JavaOpaqueBody body, SourceSpan span) implements JavaMemberDecl {
}
