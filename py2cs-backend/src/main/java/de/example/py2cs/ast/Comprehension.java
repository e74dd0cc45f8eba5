package de.example.py2cs.ast;

import java.util.List;

/** One {@code for target in iter if c1 if c2} clause of a comprehension. */
public record Comprehension(Expr target, Expr iter, List<Expr> ifs) {
  public Comprehension {
    Nodes.required(target, "Comprehension", "target");
    Nodes.required(iter, "Comprehension", "iter");
    ifs = Nodes.copy(ifs);
  }
}
