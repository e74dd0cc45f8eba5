package de.example.py2cs.ast;

/** {@code lower:upper:step}; each part may be {@code null}. */
public record Slice(Expr lower, Expr upper, Expr step) implements Expr {
  public Slice(Expr lower, Expr upper) {
    this(lower, upper, null);
  }
}
