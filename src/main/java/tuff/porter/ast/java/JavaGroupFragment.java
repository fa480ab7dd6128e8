package tuff.porter.ast.java;

import tuff.porter.ast.SourceSpan;
import tuff.porter.parse.java.GroupKind;
import tuff.porter.parse.java.JavaToken;

import java.util.List;

public record JavaGroupFragment(GroupKind kind, JavaToken open, JavaToken close, List<JavaFragment> fragments)
		implements JavaFragment {
	@Override
	public SourceSpan span() {
		return open.span().to(close.span());
	}
}
