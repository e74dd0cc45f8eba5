package de.example.py2cs.ast;

import java.util.List;

/** {@code t1 = t2 = ... = value}. Only the single-target form is translated. */
public record Assign(List<Expr> targets, Expr value) implements Stmt {
  public Assign {
    targets = Nodes.copy(targets);
    Nodes.required(value, "Assign", "value");
    if (targets.isEmpty()) throw new IllegalArgumentException("Assign.targets must not be empty");
  }

  public Assign(Expr target, Expr value) {
    this(List.of(target), value);
  }
}
