package de.example.py2cs.ast;

import java.util.List;

/** {@code if test: body else: orelse}; an {@code elif} is an {@code orelse} holding one {@code If}. */
public record If(Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
  public If {
    Nodes.required(test, "If", "test");
    body = Nodes.copy(body);
    orelse = Nodes.copy(orelse);
  }

  public If(Expr test, List<Stmt> body) {
    this(test, body, List.of());
  }
}
