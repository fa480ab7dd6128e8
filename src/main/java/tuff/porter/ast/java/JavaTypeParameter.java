package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

import java.util.List;

public record JavaTypeParameter(String name, List<JavaTypeRef> bounds, SourceSpan span) implements JavaNode {
}
