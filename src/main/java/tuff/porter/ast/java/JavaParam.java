package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

public record JavaParam(JavaModifiers modifiers, JavaTypeRef type, String name, boolean varargs, SourceSpan span)
		implements JavaNode {
}
