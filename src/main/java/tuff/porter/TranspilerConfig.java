package tuff.porter;

import java.util.HashSet;
import java.util.Set;

/**
 * Transpiler options.
 *
 * {@code knownExternalTypes} are simple type names that nested and anonymous classes may
 * extend without the file declaring or importing them.
 */
public record TranspilerConfig(
		String indent,
		String lineSeparator,
		Set<String> knownExternalTypes) {

	public static final Set<String> JAVA_LANG_TYPES = Set.of(
			"AutoCloseable", "Boolean", "Byte", "CharSequence", "Character", "Class", "ClassLoader", "Cloneable",
			"Comparable", "Double", "Enum", "Error", "Exception", "Float", "IllegalArgumentException",
			"IllegalStateException", "Integer", "Iterable", "Long", "Math", "Number", "Object", "Runnable", "Runtime",
			"RuntimeException", "Short", "String", "StringBuffer", "StringBuilder", "System", "Thread", "ThreadGroup",
			"ThreadLocal", "Throwable", "UnsupportedOperationException", "Void");

	public static final TranspilerConfig DEFAULT = new TranspilerConfig(
			"\t",
			System.lineSeparator(),
			JAVA_LANG_TYPES);

	public TranspilerConfig {
		knownExternalTypes = Set.copyOf(knownExternalTypes);
	}

	public TranspilerConfig withIndent(String indent) {
		return new TranspilerConfig(indent, lineSeparator, knownExternalTypes);
	}

	public TranspilerConfig withLineSeparator(String lineSeparator) {
		return new TranspilerConfig(indent, lineSeparator, knownExternalTypes);
	}

	/**
	 * Adds to the known external types; the defaults stay.
	 */
	public TranspilerConfig withKnownExternalTypes(Set<String> names) {
		Set<String> all = new HashSet<>(knownExternalTypes);
		all.addAll(names);
		return new TranspilerConfig(indent, lineSeparator, all);
	}
}
