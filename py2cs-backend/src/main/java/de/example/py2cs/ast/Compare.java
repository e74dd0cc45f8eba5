package de.example.py2cs.ast;

import java.util.List;

/** {@code left op0 c0 op1 c1 ...}; {@code ops} and {@code comparators} have the same size. */
public record Compare(Expr left, List<CompareOperator> ops, List<Expr> comparators) implements Expr {
  public Compare {
    Nodes.required(left, "Compare", "left");
    ops = Nodes.copy(ops);
    comparators = Nodes.copy(comparators);
    if (ops.isEmpty() || ops.size() != comparators.size()) {
      throw new IllegalArgumentException("Compare needs one comparator per operator");
    }
  }

  public Compare(Expr left, CompareOperator op, Expr right) {
    this(left, List.of(op), List.of(right));
  }
}
