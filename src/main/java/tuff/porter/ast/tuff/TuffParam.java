package tuff.porter.ast.tuff;

public record TuffParam(String name, String type) {
}
