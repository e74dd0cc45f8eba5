package de.example.py2cs.ast;

import java.util.List;

public record SetComprehension(Expr elt, List<Comprehension> generators) implements Expr {
  public SetComprehension {
    Nodes.required(elt, "SetComprehension", "elt");
    generators = Nodes.copy(generators);
    if (generators.isEmpty()) throw new IllegalArgumentException("SetComprehension needs a generator");
  }
}
