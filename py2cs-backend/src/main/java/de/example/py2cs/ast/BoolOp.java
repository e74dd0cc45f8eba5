package de.example.py2cs.ast;

import java.util.List;

public record BoolOp(BoolOperator op, List<Expr> values) implements Expr {
  public BoolOp {
    Nodes.required(op, "BoolOp", "op");
    values = Nodes.copy(values);
  }
}
