package tuff.porter.transform;

import tuff.porter.TranspilerConfig;
import tuff.porter.ast.SourceSpan;
import tuff.porter.ast.java.JavaAnonymousClassExpr;
import tuff.porter.ast.java.JavaArrayType;
import tuff.porter.ast.java.JavaClassDecl;
import tuff.porter.ast.java.JavaCompilationUnit;
import tuff.porter.ast.java.JavaConstructorDecl;
import tuff.porter.ast.java.JavaExpr;
import tuff.porter.ast.java.JavaFieldDecl;
import tuff.porter.ast.java.JavaFragment;
import tuff.porter.ast.java.JavaGroupFragment;
import tuff.porter.ast.java.JavaIdentType;
import tuff.porter.ast.java.JavaImportDecl;
import tuff.porter.ast.java.JavaInstanceInitializer;
import tuff.porter.ast.java.JavaMemberDecl;
import tuff.porter.ast.java.JavaMethodDecl;
import tuff.porter.ast.java.JavaNestedClassDecl;
import tuff.porter.ast.java.JavaOpaqueBody;
import tuff.porter.ast.java.JavaOpaqueExpr;
import tuff.porter.ast.java.JavaParam;
import tuff.porter.ast.java.JavaParameterizedType;
import tuff.porter.ast.java.JavaStaticInitializer;
import tuff.porter.ast.java.JavaTokenFragment;
import tuff.porter.ast.java.JavaTypeKind;
import tuff.porter.ast.java.JavaTypeParameter;
import tuff.porter.ast.java.JavaTypeRef;
import tuff.porter.ast.java.JavaWildcardType;
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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Java AST -> Tuff AST transformer.
 *
 * Tuff has no nested type declarations. Every nested and anonymous class becomes a
 * top-level declaration emitted ahead of its enclosing one, and the enclosing one keeps a
 * {@code type Name = Hoisted;} alias per nested class. Base types of hoisted classes must
 * resolve; other type references are rendered as written.
 *
 * A hoisted inner class or anonymous class takes the type parameters of its enclosing
 * instance context ahead of its own, and every reference to it passes them along.
 */
public final class JavaToTuffTransformer {
	private static final Map<String, String> PRIMITIVES = Map.ofEntries(
			Map.entry("char", "U16"),
			Map.entry("Character", "U16"),
			Map.entry("byte", "I8"),
			Map.entry("short", "I16"),
			Map.entry("int", "I32"),
			Map.entry("long", "I64"),
			Map.entry("float", "F32"),
			Map.entry("double", "F64"),
			Map.entry("boolean", "Bool"),
			Map.entry("void", "Void"));

	private final TranspilerConfig config;

	public JavaToTuffTransformer() {
		this(TranspilerConfig.DEFAULT);
	}

	public JavaToTuffTransformer(TranspilerConfig config) {
		this.config = config;
	}

	public TuffModule transform(JavaCompilationUnit unit) {
		List<TuffImportDecl> imports = lowerImports(unit.imports());
		Lowering lowering = new Lowering(unit);
		for (JavaClassDecl type : unit.types()) {
			lowering.lowerClass(type, lowering.names.of(type), lowering.fileScope);
		}
		return new TuffModule(imports, List.copyOf(lowering.decls), unit.span());
	}

	private List<TuffImportDecl> lowerImports(List<JavaImportDecl> imports) {
		// plain imports stay one per path; member and on-demand imports group by owner
		Map<String, List<String>> paths = new LinkedHashMap<>();
		Map<String, List<String>> names = new LinkedHashMap<>();
		Map<String, SourceSpan> spans = new LinkedHashMap<>();

		for (JavaImportDecl imp : imports) {
			List<String> parts = List.of(imp.qualifiedName().split("\\."));
			List<String> path;
			String name;
			if (imp.onDemand()) {
				path = parts;
				name = "*";
			} else if (imp.isStatic()) {
				if (parts.size() < 2) {
					continue;
				}
				path = parts.subList(0, parts.size() - 1);
				name = parts.get(parts.size() - 1);
			} else {
				path = parts;
				name = null;
			}

			String key = (name == null ? "=" : "+") + String.join(".", path);
			paths.putIfAbsent(key, path);
			spans.putIfAbsent(key, imp.span());
			List<String> grouped = names.computeIfAbsent(key, k -> new ArrayList<>());
			if (name != null && !grouped.contains(name)) {
				grouped.add(name);
			}
		}

		List<TuffImportDecl> lowered = new ArrayList<>();
		for (Map.Entry<String, List<String>> e : paths.entrySet()) {
			lowered.add(new TuffImportDecl(List.copyOf(e.getValue()), List.copyOf(names.get(e.getKey())),
					spans.get(e.getKey())));
		}
		return List.copyOf(lowered);
	}

	/**
	 * Per-file lowering state. Not shared between files.
	 */
	private final class Lowering {
		private final HoistedNames names = new HoistedNames();
		private final TypeScope fileScope;
		private final Set<String> importedTypes = new HashSet<>();
		private final boolean hasOnDemandImport;
		private final List<TuffDecl> decls = new ArrayList<>();
		private final Map<JavaClassDecl, List<JavaTypeParameter>> captured = new IdentityHashMap<>();

		Lowering(JavaCompilationUnit unit) {
			for (JavaClassDecl type : unit.types()) {
				names.reserveTopLevel(type);
			}
			for (JavaClassDecl type : unit.types()) {
				names.assignNested(type.name(), type.members());
				captured.put(type, List.of());
				recordCaptures(type.members(), type.typeParameters(), type.kind() == JavaTypeKind.INTERFACE);
			}
			this.fileScope = TypeScope.root(unit.types());

			boolean onDemand = false;
			for (JavaImportDecl imp : unit.imports()) {
				if (imp.onDemand()) {
					onDemand = true;
				} else {
					importedTypes.add(imp.simpleName());
				}
			}
			this.hasOnDemandImport = onDemand;
		}

		/**
		 * Records, for every nested class among {@code members}, the type parameters it takes
		 * over from its enclosing declarations. {@code visible} are the type parameters in
		 * scope for instance members of the enclosing declaration.
		 */
		private void recordCaptures(List<JavaMemberDecl> members, List<JavaTypeParameter> visible,
				boolean interfaceBody) {
			for (JavaMemberDecl member : members) {
				if (member instanceof JavaNestedClassDecl nested) {
					JavaClassDecl decl = nested.declaration();
					List<JavaTypeParameter> taken = isInner(decl, interfaceBody)
							? unshadowed(visible, decl.typeParameters())
							: List.of();
					captured.put(decl, taken);
					recordCaptures(decl.members(), concat(taken, decl.typeParameters()),
							decl.kind() == JavaTypeKind.INTERFACE);
				}
			}
		}

		private boolean isInner(JavaClassDecl decl, boolean interfaceBody) {
			return !interfaceBody && decl.kind() == JavaTypeKind.CLASS && !decl.modifiers().has("static");
		}

		void lowerClass(JavaClassDecl decl, String name, TypeScope enclosing) {
			List<JavaTypeParameter> typeParameters = concat(captured.getOrDefault(decl, List.of()),
					decl.typeParameters());
			Context ctx = new Context(name, enclosing.child(decl.members()), typeParameters);
			List<TuffMember> members = lowerMembers(decl.members(), ctx, decl.kind() == JavaTypeKind.INTERFACE);

			List<String> superTypes;
			List<String> interfaces;
			if (names.isTopLevel(decl)) {
				superTypes = lowerTypes(decl.extendsTypes(), enclosing);
				interfaces = lowerTypes(decl.implementsTypes(), enclosing);
			} else {
				superTypes = resolveAll(decl.extendsTypes(), enclosing);
				interfaces = resolveAll(decl.implementsTypes(), enclosing);
			}

			decls.add(new TuffClassDecl(decl.kind() == JavaTypeKind.INTERFACE, name,
					lowerTypeParameters(typeParameters, ctx.scope), superTypes, interfaces, members, decl.span()));
		}

		/**
		 * Lowers an anonymous class into its own declaration and returns the expression that
		 * instantiates it.
		 */
		String lowerAnonymous(JavaAnonymousClassExpr anonymous, Context enclosing, JavaTypeRef targetType) {
			String name = names.unique(enclosing.name + "_" + enclosing.nextAnonymousIndex());
			names.assignNested(name, anonymous.members());
			List<JavaTypeParameter> typeParameters = enclosing.visible;
			recordCaptures(anonymous.members(), typeParameters, false);

			JavaTypeRef baseType = inferDiamond(anonymous.baseType(), targetType);
			JavaClassDecl local = resolveLocal(baseType, enclosing.scope);
			String base = resolve(baseType, enclosing.scope);
			boolean implementsBase = local != null && local.kind() == JavaTypeKind.INTERFACE;

			Context ctx = new Context(name, enclosing.scope.child(anonymous.members()), typeParameters);
			List<TuffMember> members = lowerMembers(anonymous.members(), ctx, false);
			decls.add(new TuffClassDecl(false, name, lowerTypeParameters(typeParameters, enclosing.scope),
					implementsBase ? List.of() : List.of(base),
					implementsBase ? List.of(base) : List.of(),
					members, anonymous.span()));

			return name + renderGroup(anonymous.arguments(), enclosing);
		}

		/**
		 * {@code new Base<>() {...}} takes its arguments from the declared type it is assigned
		 * to when that names the same base, and is left raw otherwise.
		 */
		private JavaTypeRef inferDiamond(JavaTypeRef baseType, JavaTypeRef targetType) {
			if (!(baseType instanceof JavaParameterizedType diamond) || !diamond.arguments().isEmpty()) {
				return baseType;
			}
			if (targetType instanceof JavaParameterizedType target
					&& target.base().name().equals(diamond.base().name())) {
				return target;
			}
			return diamond.base();
		}

		private List<TuffMember> lowerMembers(List<JavaMemberDecl> members, Context ctx, boolean interfaceBody) {
			List<TuffMember> lowered = new ArrayList<>();
			for (JavaMemberDecl member : members) {
				if (member instanceof JavaNestedClassDecl nested) {
					lowered.add(new TuffTypeAlias(nested.name(), lowerLocal(nested.declaration(), List.of()),
							nested.span()));
				}
			}

			for (JavaMemberDecl member : members) {
				if (member instanceof JavaNestedClassDecl nested) {
					JavaClassDecl decl = nested.declaration();
					lowerClass(decl, names.of(decl), ctx.scope);
					continue;
				}
				lowered.add(lowerMember(member, ctx, interfaceBody));
			}
			return List.copyOf(lowered);
		}

		private TuffMember lowerMember(JavaMemberDecl member, Context ctx, boolean interfaceBody) {
			if (member instanceof JavaFieldDecl field) {
				// interface fields are implicitly static
				boolean isStatic = interfaceBody || field.modifiers().has("static");
				String init = null;
				if (field.hasInitializer()) {
					Context initCtx = isStatic ? ctx.withVisible(List.of()) : ctx;
					init = field.init() instanceof JavaAnonymousClassExpr anonymous
							? lowerAnonymous(anonymous, initCtx, field.type())
							: renderExpr(field.init(), initCtx);
				}
				return new TuffLetDecl(field.modifiers().has("static"), !field.modifiers().has("final"), field.name(),
						lowerType(field.type(), ctx.scope), init, field.span());
			}
			if (member instanceof JavaMethodDecl method) {
				List<JavaTypeParameter> outer = method.modifiers().has("static") ? List.of() : ctx.visible;
				Context bodyCtx = ctx.withVisible(concat(unshadowed(outer, method.typeParameters()),
						method.typeParameters()));
				String body = method.hasBody() ? renderBody(method.body(), bodyCtx) : null;
				return new TuffFnDecl(method.modifiers().has("static"), method.modifiers().has("abstract"),
						method.name(), lowerTypeParameters(method.typeParameters(), ctx.scope),
						lowerParams(method.params(), ctx.scope), lowerType(method.returnType(), ctx.scope), body,
						method.span());
			}
			if (member instanceof JavaConstructorDecl ctor) {
				Context bodyCtx = ctx.withVisible(concat(unshadowed(ctx.visible, ctor.typeParameters()),
						ctor.typeParameters()));
				return new TuffConstructorDecl(lowerTypeParameters(ctor.typeParameters(), ctx.scope),
						lowerParams(ctor.params(), ctx.scope), renderBody(ctor.body(), bodyCtx), ctor.span());
			}
			if (member instanceof JavaStaticInitializer init) {
				return new TuffInitDecl(true, renderBody(init.body(), ctx.withVisible(List.of())), init.span());
			}
			if (member instanceof JavaInstanceInitializer init) {
				return new TuffInitDecl(false, renderBody(init.body(), ctx), init.span());
			}
			throw new IllegalStateException("Unhandled member " + member);
		}

		private String renderExpr(JavaExpr expr, Context ctx) {
			if (expr instanceof JavaAnonymousClassExpr anonymous) {
				return lowerAnonymous(anonymous, ctx, null);
			}
			if (expr instanceof JavaOpaqueExpr opaque) {
				return renderFragments(opaque.fragments(), null, ctx, new StringBuilder()).toString();
			}
			throw new IllegalStateException("Unhandled expression " + expr);
		}

		private String renderBody(JavaOpaqueBody body, Context ctx) {
			return renderGroup(body.block(), ctx);
		}

		private String renderGroup(JavaGroupFragment group, Context ctx) {
			StringBuilder sb = new StringBuilder(group.open().lexeme());
			SourceSpan last = renderFragments(group.fragments(), group.open().span(), ctx, sb);
			if (last != null && !last.isAdjacentTo(group.close().span())) {
				sb.append(' ');
			}
			return sb.append(group.close().lexeme()).toString();
		}

		/**
		 * Appends the fragments to {@code sb}, separated by one space wherever the source had
		 * a gap. Returns the span of the last fragment written, or {@code previous}.
		 */
		private SourceSpan renderFragments(List<JavaFragment> fragments, SourceSpan previous, Context ctx,
				StringBuilder sb) {
			SourceSpan last = previous;
			for (JavaFragment fragment : fragments) {
				if (last != null && !last.isAdjacentTo(fragment.span())) {
					sb.append(' ');
				}
				sb.append(renderFragment(fragment, ctx));
				last = fragment.span();
			}
			return last;
		}

		private String renderFragment(JavaFragment fragment, Context ctx) {
			if (fragment instanceof JavaTokenFragment token) {
				return token.token().lexeme();
			}
			if (fragment instanceof JavaGroupFragment group) {
				return renderGroup(group, ctx);
			}
			if (fragment instanceof JavaAnonymousClassExpr anonymous) {
				return lowerAnonymous(anonymous, ctx, null);
			}
			throw new IllegalStateException("Unhandled fragment " + fragment);
		}

		private List<String> resolveAll(List<JavaTypeRef> types, TypeScope scope) {
			return types.stream().map(t -> resolve(t, scope)).toList();
		}

		/**
		 * Renders a base type that must resolve: to a declaration of this file, an imported
		 * or known external type, or a qualified name.
		 */
		private String resolve(JavaTypeRef type, TypeScope scope) {
			JavaIdentType base = baseName(type);
			if (base == null) {
				throw new EmissionException("Unsupported base type", describe(type), type.span());
			}
			if (resolveLocal(base, scope) == null && !base.isQualified() && !isExternal(base.name())) {
				throw new EmissionException("Unresolved base type", base.name(), base.span());
			}
			return lowerType(type, scope);
		}

		private boolean isExternal(String simpleName) {
			return hasOnDemandImport || importedTypes.contains(simpleName)
					|| config.knownExternalTypes().contains(simpleName);
		}

		/**
		 * The declaration of this file that {@code type} names, or null if it names none.
		 * A qualified name whose first segment is local must resolve all the way.
		 */
		private JavaClassDecl resolveLocal(JavaTypeRef type, TypeScope scope) {
			JavaIdentType base = baseName(type);
			if (base == null) {
				return null;
			}
			String[] parts = base.name().split("\\.");
			JavaClassDecl decl = scope.lookup(parts[0]);
			if (decl == null) {
				return null;
			}
			for (int i = 1; i < parts.length; i++) {
				decl = TypeScope.member(decl, parts[i]);
				if (decl == null) {
					throw new EmissionException("Unresolved member type", base.name(), base.span());
				}
			}
			return decl;
		}

		private JavaIdentType baseName(JavaTypeRef type) {
			if (type instanceof JavaIdentType ident) {
				return ident;
			}
			if (type instanceof JavaParameterizedType parameterized) {
				return parameterized.base();
			}
			return null;
		}

		private List<String> lowerTypes(List<JavaTypeRef> types, TypeScope scope) {
			return types.stream().map(t -> lowerType(t, scope)).toList();
		}

		private String lowerType(JavaTypeRef type, TypeScope scope) {
			if (type instanceof JavaIdentType ident) {
				String primitive = PRIMITIVES.get(ident.name());
				if (primitive != null) {
					return primitive;
				}
				JavaClassDecl local = resolveLocal(ident, scope);
				return local == null ? ident.name() : lowerLocal(local, List.of());
			}
			if (type instanceof JavaParameterizedType parameterized) {
				List<String> arguments = lowerTypes(parameterized.arguments(), scope);
				JavaClassDecl local = resolveLocal(parameterized.base(), scope);
				if (local != null) {
					return lowerLocal(local, arguments);
				}
				return withArguments(parameterized.base().name(), arguments);
			}
			if (type instanceof JavaArrayType array) {
				return "[" + lowerType(array.component(), scope) + "]";
			}
			if (type instanceof JavaWildcardType wildcard) {
				return switch (wildcard.bound()) {
					case NONE -> "?";
					case EXTENDS -> "? extends " + lowerType(wildcard.boundType(), scope);
					case SUPER -> "? super " + lowerType(wildcard.boundType(), scope);
				};
			}
			throw new IllegalStateException("Unhandled type " + type);
		}

		/**
		 * Hoisted name of a declaration of this file, with the type parameters it captured
		 * ahead of {@code arguments}.
		 */
		private String lowerLocal(JavaClassDecl decl, List<String> arguments) {
			List<String> all = new ArrayList<>();
			for (JavaTypeParameter parameter : captured.getOrDefault(decl, List.of())) {
				all.add(parameter.name());
			}
			all.addAll(arguments);
			return withArguments(names.of(decl), all);
		}

		private String withArguments(String base, List<String> arguments) {
			return arguments.isEmpty() ? base : base + "<" + String.join(", ", arguments) + ">";
		}

		private List<String> lowerTypeParameters(List<JavaTypeParameter> parameters, TypeScope scope) {
			return parameters.stream().map(p -> lowerTypeParameter(p, scope)).toList();
		}

		private String lowerTypeParameter(JavaTypeParameter parameter, TypeScope scope) {
			if (parameter.bounds().isEmpty()) {
				return parameter.name();
			}
			return parameter.name() + " extends " + parameter.bounds().stream()
					.map(t -> lowerType(t, scope))
					.collect(Collectors.joining(" & "));
		}

		private List<TuffParam> lowerParams(List<JavaParam> params, TypeScope scope) {
			return params.stream()
					.map(p -> new TuffParam(p.name(), (p.varargs() ? "..." : "") + lowerType(p.type(), scope)))
					.toList();
		}

		private String describe(JavaTypeRef type) {
			return lowerType(type, fileScope);
		}
	}

	private static List<JavaTypeParameter> concat(List<JavaTypeParameter> first, List<JavaTypeParameter> second) {
		if (first.isEmpty()) {
			return second;
		}
		List<JavaTypeParameter> all = new ArrayList<>(first);
		all.addAll(second);
		return List.copyOf(all);
	}

	/**
	 * The entries of {@code outer} not redeclared by {@code own}.
	 */
	private static List<JavaTypeParameter> unshadowed(List<JavaTypeParameter> outer, List<JavaTypeParameter> own) {
		if (outer.isEmpty() || own.isEmpty()) {
			return outer;
		}
		Set<String> declared = own.stream().map(JavaTypeParameter::name).collect(Collectors.toSet());
		return outer.stream().filter(p -> !declared.contains(p.name())).toList();
	}

	/**
	 * The declaration whose members are being lowered: its hoisted name, its scope, the type
	 * parameters an anonymous class met here takes over, and the number of anonymous classes
	 * met in it so far. Views made by {@link #withVisible} share the count with their owner.
	 */
	private static final class Context {
		private final String name;
		private final TypeScope scope;
		private final List<JavaTypeParameter> visible;
		private final Context owner;
		private int anonymousCount;

		Context(String name, TypeScope scope, List<JavaTypeParameter> visible) {
			this(name, scope, visible, null);
		}

		private Context(String name, TypeScope scope, List<JavaTypeParameter> visible, Context owner) {
			this.name = name;
			this.scope = scope;
			this.visible = visible;
			this.owner = owner;
		}

		Context withVisible(List<JavaTypeParameter> visible) {
			return new Context(name, scope, visible, owner == null ? this : owner);
		}

		int nextAnonymousIndex() {
			return owner == null ? ++anonymousCount : owner.nextAnonymousIndex();
		}
	}
}
