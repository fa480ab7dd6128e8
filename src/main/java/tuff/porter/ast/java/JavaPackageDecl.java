package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

public record JavaPackageDecl(String name, SourceSpan span) implements JavaNode {
}
