package tuff.porter.print;

import tuff.porter.TranspilerConfig;
import tuff.porter.ast.tuff.TuffClassDecl;
import tuff.porter.ast.tuff.TuffConstructorDecl;
import tuff.porter.ast.tuff.TuffDecl;
import tuff.porter.ast.tuff.TuffFnDecl;
import tuff.porter.ast.tuff.TuffImportDecl;
import tuff.porter.ast.tuff.TuffInitDecl;
import tuff.porter.ast.tuff.TuffLetDecl;
import tuff.porter.ast.tuff.TuffMember;
import tuff.porter.ast.tuff.TuffModule;
import tuff.porter.ast.tuff.TuffParam;
import tuff.porter.ast.tuff.TuffTypeAlias;

import java.util.List;
import java.util.stream.Collectors;

public final class TuffPrinter {
	private final TranspilerConfig config;

	public TuffPrinter() {
		this(TranspilerConfig.DEFAULT);
	}

	public TuffPrinter(TranspilerConfig config) {
		this.config = config;
	}

	public String print(TuffModule module) {
		StringBuilder out = new StringBuilder();
		String nl = config.lineSeparator();

		for (TuffImportDecl imp : module.imports()) {
			out.append("from ")
					.append(String.join("::", imp.modulePath()));
			if (imp.isDefaultImport()) {
				out.append(";").append(nl);
				continue;
			}
			out.append(" use { ")
					.append(String.join(", ", imp.names()))
					.append(" };")
					.append(nl);
		}

		for (TuffDecl decl : module.decls()) {
			out.append(printDecl(decl)).append(nl);
		}

		return out.toString();
	}

	private String printDecl(TuffDecl decl) {
		if (decl instanceof TuffClassDecl clazz) {
			return printClass(clazz);
		}
		throw new IllegalStateException("Unhandled declaration " + decl);
	}

	private String printClass(TuffClassDecl clazz) {
		String nl = config.lineSeparator();
		StringBuilder sb = new StringBuilder();

		if (clazz.isInterface()) {
			sb.append("interface ").append(clazz.name()).append(typeParameters(clazz.typeParameters()));
		} else {
			sb.append("class fn ").append(clazz.name()).append(typeParameters(clazz.typeParameters())).append("()");
		}
		if (!clazz.superTypes().isEmpty()) {
			sb.append(" extends ").append(String.join(", ", clazz.superTypes()));
		}
		if (!clazz.interfaces().isEmpty()) {
			sb.append(" implements ").append(String.join(", ", clazz.interfaces()));
		}
		sb.append(" => {");

		if (clazz.members().isEmpty()) {
			return sb.append("}").toString();
		}
		for (TuffMember member : clazz.members()) {
			sb.append(nl).append(config.indent()).append(printMember(member));
		}
		sb.append(nl).append("}");
		return sb.toString();
	}

	private String printMember(TuffMember member) {
		if (member instanceof TuffTypeAlias alias) {
			return "type " + alias.name() + " = " + alias.target() + ";";
		}
		if (member instanceof TuffLetDecl let) {
			return printLet(let);
		}
		if (member instanceof TuffFnDecl fn) {
			return printFn(fn);
		}
		if (member instanceof TuffConstructorDecl ctor) {
			return "fn new" + typeParameters(ctor.typeParameters()) + params(ctor.params()) + " => " + ctor.body();
		}
		if (member instanceof TuffInitDecl init) {
			return (init.isStatic() ? "static " : "") + "init => " + init.body();
		}
		throw new IllegalStateException("Unhandled member " + member);
	}

	private String printLet(TuffLetDecl let) {
		StringBuilder sb = new StringBuilder();
		if (let.isStatic()) {
			sb.append("static ");
		}
		sb.append(let.isMutable() ? "let mut " : "let ").append(let.name()).append(" : ").append(let.type());
		if (let.init() != null) {
			sb.append(" = ").append(let.init());
		}
		return sb.append(";").toString();
	}

	private String printFn(TuffFnDecl fn) {
		StringBuilder sb = new StringBuilder();
		if (fn.isStatic()) {
			sb.append("static ");
		}
		if (fn.isAbstract()) {
			sb.append("abstract ");
		}
		sb.append("fn ").append(fn.name())
				.append(typeParameters(fn.typeParameters()))
				.append(params(fn.params()))
				.append(" : ").append(fn.returnType());
		if (fn.body() == null) {
			return sb.append(";").toString();
		}
		return sb.append(" => ").append(fn.body()).toString();
	}

	private static String params(List<TuffParam> params) {
		return params.stream()
				.map(p -> p.name() + " : " + p.type())
				.collect(Collectors.joining(", ", "(", ")"));
	}

	private static String typeParameters(List<String> typeParameters) {
		if (typeParameters.isEmpty()) {
			return "";
		}
		return "<" + String.join(", ", typeParameters) + ">";
	}
}
