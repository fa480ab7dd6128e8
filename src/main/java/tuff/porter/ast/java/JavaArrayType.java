package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

public record JavaArrayType(JavaTypeRef component, SourceSpan span) implements JavaTypeRef {
}
