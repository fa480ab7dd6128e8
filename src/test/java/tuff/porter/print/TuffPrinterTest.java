package tuff.porter.print;

import org.junit.jupiter.api.Test;
import tuff.porter.TranspilerConfig;
import tuff.porter.ast.SourceSpan;
import tuff.porter.ast.tuff.TuffClassDecl;
import tuff.porter.ast.tuff.TuffConstructorDecl;
import tuff.porter.ast.tuff.TuffFnDecl;
import tuff.porter.ast.tuff.TuffImportDecl;
import tuff.porter.ast.tuff.TuffInitDecl;
import tuff.porter.ast.tuff.TuffLetDecl;
import tuff.porter.ast.tuff.TuffModule;
import tuff.porter.ast.tuff.TuffParam;
import tuff.porter.ast.tuff.TuffTypeAlias;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TuffPrinterTest {
	@Test
	void printsImportStatementsAndEmptyClass() {
		TuffModule module = new TuffModule(
				List.of(
						new TuffImportDecl(List.of("java", "util"), List.of("List", "Map"), SourceSpan.NONE),
						new TuffImportDecl(List.of("root", "nibling", "Cousin"), List.of(), SourceSpan.NONE)),
				List.of(new TuffClassDecl(false, "X", List.of(), List.of(), List.of(), List.of(), SourceSpan.NONE)),
				SourceSpan.NONE);

		String out = new TuffPrinter().print(module);
		assertEquals(
				normalize("from java::util use { List, Map };\nfrom root::nibling::Cousin;\nclass fn X() => {}\n"),
				normalize(out));
	}

	@Test
	void printsEveryMemberKind() {
		TuffClassDecl clazz = new TuffClassDecl(false, "Box", List.of("T"), List.of("Base"), List.of("Api", "Other"),
				List.of(
						new TuffTypeAlias("Inner", "Box_Inner", SourceSpan.NONE),
						new TuffLetDecl(true, false, "SIZE", "I32", "4", SourceSpan.NONE),
						new TuffLetDecl(false, true, "value", "T", null, SourceSpan.NONE),
						new TuffConstructorDecl(List.of(), List.of(new TuffParam("value", "T")),
								"{ this.value = value; }", SourceSpan.NONE),
						new TuffInitDecl(true, "{ load(); }", SourceSpan.NONE),
						new TuffInitDecl(false, "{}", SourceSpan.NONE),
						new TuffFnDecl(false, false, "get", List.of(), List.of(), "T", "{ return value; }",
								SourceSpan.NONE),
						new TuffFnDecl(true, true, "map", List.of("R"),
								List.of(new TuffParam("f", "Fn<T, R>"), new TuffParam("rest", "...I32")), "R", null,
								SourceSpan.NONE)),
				SourceSpan.NONE);

		String out = new TuffPrinter(TranspilerConfig.DEFAULT.withIndent("  ").withLineSeparator("\n"))
				.print(new TuffModule(List.of(), List.of(clazz), SourceSpan.NONE));

		assertEquals(
				"class fn Box<T>() extends Base implements Api, Other => {\n" +
						"  type Inner = Box_Inner;\n" +
						"  static let SIZE : I32 = 4;\n" +
						"  let mut value : T;\n" +
						"  fn new(value : T) => { this.value = value; }\n" +
						"  static init => { load(); }\n" +
						"  init => {}\n" +
						"  fn get() : T => { return value; }\n" +
						"  static abstract fn map<R>(f : Fn<T, R>, rest : ...I32) : R;\n" +
						"}\n",
				out);
	}

	@Test
	void printsInterfaceHeader() {
		TuffClassDecl api = new TuffClassDecl(true, "Api", List.of("T"), List.of("Base"), List.of(), List.of(),
				SourceSpan.NONE);

		String out = new TuffPrinter().print(new TuffModule(List.of(), List.of(api), SourceSpan.NONE));

		assertEquals(normalize("interface Api<T> extends Base => {}\n"), normalize(out));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
