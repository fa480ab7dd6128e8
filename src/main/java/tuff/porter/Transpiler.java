package tuff.porter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tuff.porter.ast.java.JavaCompilationUnit;
import tuff.porter.ast.tuff.TuffModule;
import tuff.porter.parse.java.JavaParser;
import tuff.porter.print.TuffPrinter;
import tuff.porter.transform.JavaToTuffTransformer;

/**
 * Public entrypoint for Java -> Tuff transpilation of a single file.
 *
 * The whole output is built before anything is returned: a file either transpiles
 * completely or fails with a {@link TranspileException}.
 */
public final class Transpiler {
	private static final Logger LOG = LoggerFactory.getLogger(Transpiler.class);

	private final TranspilerConfig config;

	public Transpiler() {
		this(TranspilerConfig.DEFAULT);
	}

	public Transpiler(TranspilerConfig config) {
		this.config = config;
	}

	public String transpile(String javaSource) {
		JavaCompilationUnit unit = new JavaParser().parse(javaSource);
		LOG.debug("Parsed {} import(s) and {} type(s)", unit.imports().size(), unit.types().size());

		TuffModule module = new JavaToTuffTransformer(config).transform(unit);
		LOG.debug("Lowered to {} declaration(s)", module.decls().size());

		return new TuffPrinter(config).print(module);
	}
}
