package de.example.py2cs.ast;

/** {@code value[slice]}; {@code slice} is a {@link Slice} for {@code a[lo:hi]}, any other expression for indexing. */
public record Subscript(Expr value, Expr slice) implements Expr {
  public Subscript {
    Nodes.required(value, "Subscript", "value");
    Nodes.required(slice, "Subscript", "slice");
  }
}
