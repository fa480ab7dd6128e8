package tuff.porter.parse.java.match;

import tuff.porter.ast.java.JavaMemberDecl;
import tuff.porter.ast.java.JavaNode;

import java.util.List;

/**
 * The fixed matcher sets and their priority order.
 *
 * Class bodies try, in order: field, method, nested class, static initializer, instance
 * initializer, constructor. Compilation units try package, import, type declaration.
 */
public final class JavaMatchers {
	private final BodyDispatcher<JavaMemberDecl> classBody;
	private final BodyDispatcher<JavaNode> compilationUnit;

	public JavaMatchers() {
		AnonymousClassScanner anonymousClasses = new AnonymousClassScanner(this);
		ClassDeclarations classes = new ClassDeclarations(this);

		this.classBody = new BodyDispatcher<>(List.<ConstructMatcher<? extends JavaMemberDecl>>of(
				new FieldMatcher(anonymousClasses),
				new MethodMatcher(anonymousClasses),
				new NestedClassMatcher(classes),
				new StaticInitializerMatcher(anonymousClasses),
				new InstanceInitializerMatcher(anonymousClasses),
				new ConstructorMatcher(anonymousClasses)));

		this.compilationUnit = new BodyDispatcher<>(List.<ConstructMatcher<? extends JavaNode>>of(
				new PackageMatcher(),
				new ImportMatcher(),
				new TypeDeclarationMatcher(classes)));
	}

	public BodyDispatcher<JavaMemberDecl> classBody() {
		return classBody;
	}

	public BodyDispatcher<JavaNode> compilationUnit() {
		return compilationUnit;
	}
}
