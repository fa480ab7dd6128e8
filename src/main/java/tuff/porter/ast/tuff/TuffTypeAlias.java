package tuff.porter.ast.tuff;

import tuff.porter.ast.SourceSpan;

/**
 * {@code type B = A_B;} the edge from an enclosing declaration to a hoisted nested one.
 */
public record TuffTypeAlias(String name, String target, SourceSpan span) implements TuffMember {
}
