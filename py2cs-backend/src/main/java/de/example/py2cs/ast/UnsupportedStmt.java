package de.example.py2cs.ast;

/** A statement whose kind is outside the modelled set, e.g. {@code With} or {@code Delete}. */
public record UnsupportedStmt(String kind) implements Stmt {
  public UnsupportedStmt {
    Nodes.required(kind, "UnsupportedStmt", "kind");
  }
}
