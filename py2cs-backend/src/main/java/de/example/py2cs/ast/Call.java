package de.example.py2cs.ast;

import java.util.List;

public record Call(Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {
  public Call {
    Nodes.required(func, "Call", "func");
    args = Nodes.copy(args);
    keywords = Nodes.copy(keywords);
  }

  public Call(Expr func, List<Expr> args) {
    this(func, args, List.of());
  }
}
