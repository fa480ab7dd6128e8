package tuff.porter.transform;

import tuff.porter.ast.java.JavaClassDecl;
import tuff.porter.ast.java.JavaMemberDecl;
import tuff.porter.ast.java.JavaNestedClassDecl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lexical scope of type names: the member types of one declaration, backed by the scope
 * of its enclosing declaration. The root holds the file's top-level types.
 */
final class TypeScope {
	private final TypeScope parent;
	private final Map<String, JavaClassDecl> types;

	private TypeScope(TypeScope parent, Map<String, JavaClassDecl> types) {
		this.parent = parent;
		this.types = types;
	}

	static TypeScope root(List<JavaClassDecl> topLevel) {
		Map<String, JavaClassDecl> types = new LinkedHashMap<>();
		for (JavaClassDecl type : topLevel) {
			types.putIfAbsent(type.name(), type);
		}
		return new TypeScope(null, types);
	}

	TypeScope child(List<JavaMemberDecl> members) {
		Map<String, JavaClassDecl> types = new LinkedHashMap<>();
		for (JavaMemberDecl member : members) {
			if (member instanceof JavaNestedClassDecl nested) {
				types.putIfAbsent(nested.name(), nested.declaration());
			}
		}
		return new TypeScope(this, types);
	}

	/**
	 * Innermost declaration named {@code simpleName}, or null.
	 */
	JavaClassDecl lookup(String simpleName) {
		for (TypeScope scope = this; scope != null; scope = scope.parent) {
			JavaClassDecl found = scope.types.get(simpleName);
			if (found != null) {
				return found;
			}
		}
		return null;
	}

	static JavaClassDecl member(JavaClassDecl owner, String simpleName) {
		for (JavaMemberDecl member : owner.members()) {
			if (member instanceof JavaNestedClassDecl nested && nested.name().equals(simpleName)) {
				return nested.declaration();
			}
		}
		return null;
	}
}
