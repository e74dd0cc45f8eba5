package de.example.py2cs.ast;

import java.util.List;

public record ListComprehension(Expr elt, List<Comprehension> generators) implements Expr {
  public ListComprehension {
    Nodes.required(elt, "ListComprehension", "elt");
    generators = Nodes.copy(generators);
    if (generators.isEmpty()) throw new IllegalArgumentException("ListComprehension needs a generator");
  }
}
