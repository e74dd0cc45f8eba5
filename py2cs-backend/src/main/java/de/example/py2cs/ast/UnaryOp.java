package de.example.py2cs.ast;

public record UnaryOp(UnaryOperator op, Expr operand) implements Expr {
  public UnaryOp {
    Nodes.required(op, "UnaryOp", "op");
    Nodes.required(operand, "UnaryOp", "operand");
  }
}
