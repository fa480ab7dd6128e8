package tuff.porter.transform;

import org.junit.jupiter.api.Test;
import tuff.porter.ast.tuff.TuffImportDecl;
import tuff.porter.ast.tuff.TuffModule;
import tuff.porter.parse.java.JavaParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JavaToTuffTransformerImportTest {
	@Test
	void lowersNonStaticImportAsDefaultModuleImport() {
		String src = "import root.nibling.Cousin;\n" +
				"class X { int x = 0; int f() { return 0; } }\n";

		TuffModule module = transform(src);

		assertEquals(1, module.imports().size());
		TuffImportDecl imp = assertInstanceOf(TuffImportDecl.class, module.imports().get(0));
		assertEquals(List.of("root", "nibling", "Cousin"), imp.modulePath());
		assertEquals(List.of(), imp.names());
		assertTrue(imp.isDefaultImport());
	}

	@Test
	void lowersStaticMemberImportAsUseImport() {
		String src = "import static root.nibling.Cousin.getSomeValue;\n" +
				"class X { int x = 0; int f() { return 0; } }\n";

		TuffModule module = transform(src);

		assertEquals(1, module.imports().size());
		TuffImportDecl imp = assertInstanceOf(TuffImportDecl.class, module.imports().get(0));
		assertEquals(List.of("root", "nibling", "Cousin"), imp.modulePath());
		assertEquals(List.of("getSomeValue"), imp.names());
	}

	@Test
	void groupsStaticImportsByOwnerInFirstSeenOrder() {
		String src = "import static a.B.one;\n" +
				"import c.D;\n" +
				"import static a.B.two;\n" +
				"import static a.B.one;\n" +
				"class X {}\n";

		TuffModule module = transform(src);

		assertEquals(2, module.imports().size());
		assertEquals(List.of("a", "B"), module.imports().get(0).modulePath());
		assertEquals(List.of("one", "two"), module.imports().get(0).names());
		assertEquals(List.of("c", "D"), module.imports().get(1).modulePath());
	}

	@Test
	void lowersOnDemandImportAsStarUse() {
		TuffModule module = transform("import java.util.*;\nclass X {}\n");

		TuffImportDecl imp = module.imports().get(0);
		assertEquals(List.of("java", "util"), imp.modulePath());
		assertEquals(List.of("*"), imp.names());
	}

	@Test
	void keepsPlainAndStaticImportsOfTheSamePathApart() {
		String src = "import a.B;\n" +
				"import static a.B.C;\n" +
				"class X {}\n";

		TuffModule module = transform(src);

		assertEquals(2, module.imports().size());
		assertEquals(List.of("a", "B"), module.imports().get(0).modulePath());
		assertTrue(module.imports().get(0).isDefaultImport());
		assertEquals(List.of("a", "B"), module.imports().get(1).modulePath());
		assertEquals(List.of("C"), module.imports().get(1).names());
	}

	private static TuffModule transform(String src) {
		return new JavaToTuffTransformer().transform(new JavaParser().parse(src));
	}
}
