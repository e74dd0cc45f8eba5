package de.example.py2cs.ast;

/**
 * One element of a parsed Python syntax tree.
 *
 * <p>The set of kinds is closed: every node is either a {@link Stmt} or an {@link Expr}.
 * Kinds the translator does not model arrive as {@link UnsupportedStmt} / {@link UnsupportedExpr}.
 */
public sealed interface Node permits Stmt, Expr {

  /** Kind tag, e.g. {@code "Assign"} or {@code "Call"}. */
  default String kind() {
    return getClass().getSimpleName();
  }
}
