package de.example.py2cs.ast;

/** {@code raise [exc [from cause]]}. */
public record Raise(Expr exc, Expr cause) implements Stmt {
  public Raise(Expr exc) {
    this(exc, null);
  }
}
