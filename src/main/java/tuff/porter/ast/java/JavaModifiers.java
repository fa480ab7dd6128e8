package tuff.porter.ast.java;

import java.util.List;

/**
 * Modifier keywords and annotations in source order. Annotations keep their source text,
 * e.g. {@code @SuppressWarnings("unchecked")}.
 */
public record JavaModifiers(List<String> keywords, List<String> annotations) {
	public static final JavaModifiers NONE = new JavaModifiers(List.of(), List.of());

	public JavaModifiers {
		keywords = List.copyOf(keywords);
		annotations = List.copyOf(annotations);
	}

	public boolean has(String keyword) {
		return keywords.contains(keyword);
	}

	public boolean isEmpty() {
		return keywords.isEmpty() && annotations.isEmpty();
	}
}
