package tuff.porter.ast.java;

/**
 * Piece of an opaque token span.
 */
public sealed interface JavaFragment extends JavaNode permits JavaTokenFragment, JavaGroupFragment,
		JavaAnonymousClassExpr {
}
