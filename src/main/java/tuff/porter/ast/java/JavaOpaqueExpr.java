package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

import java.util.List;

public record JavaOpaqueExpr(List<JavaFragment> fragments, SourceSpan span) implements JavaExpr {
}
