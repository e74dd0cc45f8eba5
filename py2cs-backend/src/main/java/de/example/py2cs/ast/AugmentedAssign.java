package de.example.py2cs.ast;

/** {@code target op= value}. */
public record AugmentedAssign(Expr target, BinaryOperator op, Expr value) implements Stmt {
  public AugmentedAssign {
    Nodes.required(target, "AugmentedAssign", "target");
    Nodes.required(op, "AugmentedAssign", "op");
    Nodes.required(value, "AugmentedAssign", "value");
  }
}
