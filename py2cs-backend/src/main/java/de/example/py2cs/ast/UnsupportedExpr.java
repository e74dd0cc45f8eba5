package de.example.py2cs.ast;

/** An expression whose kind is outside the modelled set, e.g. {@code Lambda} or {@code Starred}. */
public record UnsupportedExpr(String kind) implements Expr {
  public UnsupportedExpr {
    Nodes.required(kind, "UnsupportedExpr", "kind");
  }
}
