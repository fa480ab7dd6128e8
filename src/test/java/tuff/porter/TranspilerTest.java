package tuff.porter;

import org.junit.jupiter.api.Test;
import tuff.porter.parse.java.UnbalancedBracketException;
import tuff.porter.parse.java.match.UnrecognizedMemberException;
import tuff.porter.transform.EmissionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TranspilerTest {
	private final Transpiler transpiler = new Transpiler(TranspilerConfig.DEFAULT.withLineSeparator("\n"));

	@Test
	void replacesAnonymousInitializerWithSynthesizedSubclass() {
		String src = "package p;\n" +
				"class A {\n" +
				"\tclass B { void m() {} }\n" +
				"\tB x = new B() { void m() { } };\n" +
				"}\n";

		assertEquals(
				"class fn A_B() => {\n" +
						"\tfn m() : Void => {}\n" +
						"}\n" +
						"class fn A_1() extends A_B => {\n" +
						"\tfn m() : Void => { }\n" +
						"}\n" +
						"class fn A() => {\n" +
						"\ttype B = A_B;\n" +
						"\tlet mut x : A_B = A_1();\n" +
						"}\n",
				transpiler.transpile(src));
	}

	@Test
	void keepsShiftInsideIndexInMethodBody() {
		String src = "class A {\n" +
				"\tboolean m(int[] a, int n) {\n" +
				"\t\tif (n < a[n >> 1]) { return true; }\n" +
				"\t\treturn false;\n" +
				"\t}\n" +
				"}\n";

		assertEquals(
				"class fn A() => {\n" +
						"\tfn m(a : [I32], n : I32) : Bool => { if (n < a[n >> 1]) { return true; } return false; }\n" +
						"}\n",
				transpiler.transpile(src));
	}

	@Test
	void dropsTypeUseAnnotationsInTypeArguments() {
		assertEquals("class fn A() => {\n\tlet mut xs : List<String>;\n}\n",
				transpiler.transpile("class A {\n\tList<@Ann(\"x\") String> xs;\n}\n"));
	}

	@Test
	void failsWholeFileOnUnbalancedBrace() {
		var ex = assertThrows(UnbalancedBracketException.class,
				() -> transpiler.transpile("class A {\n\tvoid m() {\n\t\tif (x) {\n\t}\n}\n"));

		TranspileFailure failure = ex.toFailure();
		assertEquals(ErrorKind.UNBALANCED_BRACKET, failure.kind());
		assertEquals(1, failure.line());
		assertEquals(9, failure.column());
		assertEquals("{", failure.offendingText());
		assertEquals("Unclosed '{' at 1:9: {", failure.message());
	}

	@Test
	void reportsUnrecognizedMemberWithItsText() {
		var ex = assertThrows(UnrecognizedMemberException.class,
				() -> transpiler.transpile("class A {\n\tint a, b;\n}\n"));

		assertEquals(ErrorKind.UNRECOGNIZED_MEMBER, ex.kind());
		assertEquals(2, ex.line());
		assertEquals(2, ex.column());
		assertEquals("int", ex.offendingText());
	}

	@Test
	void reportsUnresolvedBase() {
		var ex = assertThrows(EmissionException.class,
				() -> transpiler.transpile("class A { Object o = new Nowhere() {}; }"));

		assertEquals("Nowhere", ex.toFailure().offendingText());
	}

	@Test
	void emptyFileGivesEmptyOutput() {
		assertEquals("", transpiler.transpile("// nothing here\n"));
	}
}
