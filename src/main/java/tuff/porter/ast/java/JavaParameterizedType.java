package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;

import java.util.List;

/**
 * {@code base<arguments>}; an empty argument list is the diamond.
 */
public record JavaParameterizedType(JavaIdentType base, List<JavaTypeRef> arguments, SourceSpan span)
		implements JavaTypeRef {
}
