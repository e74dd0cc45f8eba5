package de.example.py2cs.ast;

public record ExpressionStatement(Expr value) implements Stmt {
  public ExpressionStatement {
    Nodes.required(value, "ExpressionStatement", "value");
  }
}
