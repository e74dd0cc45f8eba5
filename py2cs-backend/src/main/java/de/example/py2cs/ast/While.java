package de.example.py2cs.ast;

import java.util.List;

public record While(Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
  public While {
    Nodes.required(test, "While", "test");
    body = Nodes.copy(body);
    orelse = Nodes.copy(orelse);
  }

  public While(Expr test, List<Stmt> body) {
    this(test, body, List.of());
  }
}
