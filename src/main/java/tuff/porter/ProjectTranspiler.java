package tuff.porter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Transpiles a tree of Java source files to a parallel tree of .tuff files.
 *
 * Each input file produces one output file; modules are never merged. A file that fails
 * to transpile is reported and skipped, the rest of the tree is still processed.
 */
public final class ProjectTranspiler {
	private static final Logger LOG = LoggerFactory.getLogger(ProjectTranspiler.class);
	private static final String JAVA_SUFFIX = ".java";

	private final TranspilerConfig config;

	public ProjectTranspiler() {
		this(TranspilerConfig.DEFAULT);
	}

	public ProjectTranspiler(TranspilerConfig config) {
		this.config = config;
	}

	public TranspileReport transpileTree(Path javaRoot, Path tuffOutRoot) throws IOException {
		List<Path> sources;
		try (Stream<Path> paths = Files.walk(javaRoot)) {
			sources = paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(JAVA_SUFFIX))
					.sorted()
					.toList();
		}

		List<Path> written = new ArrayList<>();
		Map<Path, TranspileFailure> failed = new LinkedHashMap<>();
		try {
			sources.forEach(p -> {
				try {
					transpileOne(javaRoot, tuffOutRoot, p, written, failed);
				} catch (IOException e) {
					throw new RuntimeException(e);
				}
			});
		} catch (RuntimeException ex) {
			if (ex.getCause() instanceof IOException io) {
				throw io;
			}
			throw ex;
		}

		LOG.info("Transpiled {} file(s), skipped {}", written.size(), failed.size());
		return new TranspileReport(List.copyOf(written), Map.copyOf(failed));
	}

	private void transpileOne(Path javaRoot, Path tuffOutRoot, Path javaFile, List<Path> written,
			Map<Path, TranspileFailure> failed) throws IOException {
		Path rel = javaRoot.relativize(javaFile);
		String base = baseName(rel);
		Path outRel = rel.getParent() == null ? Path.of(base + ".tuff") : rel.getParent().resolve(base + ".tuff");
		Path outFile = tuffOutRoot.resolve(outRel);

		String javaSource = Files.readString(javaFile);
		String tuffSource;
		try {
			Transpiler transpiler = new Transpiler(config.withKnownExternalTypes(siblingTypes(javaFile)));
			tuffSource = transpiler.transpile(javaSource);
		} catch (TranspileException e) {
			LOG.warn("Skipping {}: {}", rel, e.getMessage());
			failed.put(javaFile, e.toFailure());
			return;
		}

		Files.createDirectories(outFile.getParent());
		Files.writeString(outFile, tuffSource);
		written.add(outFile);
		LOG.debug("Wrote {}", outFile);
	}

	/**
	 * Types of the same package, approximated by the base names of the .java files next to
	 * {@code javaFile}.
	 */
	private static Set<String> siblingTypes(Path javaFile) throws IOException {
		Set<String> names = new HashSet<>();
		Path dir = javaFile.getParent();
		if (dir == null) {
			return names;
		}
		try (Stream<Path> siblings = Files.list(dir)) {
			siblings
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(JAVA_SUFFIX))
					.forEach(p -> names.add(baseName(p)));
		}
		return names;
	}

	private static String baseName(Path file) {
		String fileName = file.getFileName().toString();
		return fileName.substring(0, fileName.length() - JAVA_SUFFIX.length());
	}
}
