package de.example.py2cs.ast;

import java.util.List;

/** {@code for target in iter: body else: orelse}. */
public record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse) implements Stmt {
  public For {
    Nodes.required(target, "For", "target");
    Nodes.required(iter, "For", "iter");
    body = Nodes.copy(body);
    orelse = Nodes.copy(orelse);
  }

  public For(Expr target, Expr iter, List<Stmt> body) {
    this(target, iter, body, List.of());
  }
}
