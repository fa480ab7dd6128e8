package tuff.porter.transform;

import tuff.porter.ast.java.JavaClassDecl;
import tuff.porter.ast.java.JavaMemberDecl;
import tuff.porter.ast.java.JavaNestedClassDecl;

import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Top-level names for every declaration of one file. Names are unique within the file:
 * a clash gets a {@code _2}, {@code _3}, ... suffix.
 */
final class HoistedNames {
	private final Set<String> taken = new HashSet<>();
	private final Map<JavaClassDecl, String> names = new IdentityHashMap<>();
	private final Set<JavaClassDecl> topLevel = Collections.newSetFromMap(new IdentityHashMap<>());

	void reserveTopLevel(JavaClassDecl type) {
		taken.add(type.name());
		names.put(type, type.name());
		topLevel.add(type);
	}

	boolean isTopLevel(JavaClassDecl declaration) {
		return topLevel.contains(declaration);
	}

	/**
	 * Names every nested class among {@code members}, depth first in source order, as
	 * {@code <owner>_<Name>}.
	 */
	void assignNested(String owner, List<JavaMemberDecl> members) {
		for (JavaMemberDecl member : members) {
			if (member instanceof JavaNestedClassDecl nested) {
				String name = unique(owner + "_" + nested.name());
				names.put(nested.declaration(), name);
				assignNested(name, nested.members());
			}
		}
	}

	String unique(String candidate) {
		String name = candidate;
		int suffix = 2;
		while (!taken.add(name)) {
			name = candidate + "_" + suffix++;
		}
		return name;
	}

	String of(JavaClassDecl declaration) {
		String name = names.get(declaration);
		if (name == null) {
			throw new IllegalStateException("No hoisted name for " + declaration.name());
		}
		return name;
	}
}
