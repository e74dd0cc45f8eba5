package de.example.py2cs.ast;

public record BinaryOp(Expr left, BinaryOperator op, Expr right) implements Expr {
  public BinaryOp {
    Nodes.required(left, "BinaryOp", "left");
    Nodes.required(op, "BinaryOp", "op");
    Nodes.required(right, "BinaryOp", "right");
  }
}
