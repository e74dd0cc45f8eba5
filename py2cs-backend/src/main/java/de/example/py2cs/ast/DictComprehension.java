package de.example.py2cs.ast;

import java.util.List;

public record DictComprehension(Expr key, Expr value, List<Comprehension> generators) implements Expr {
  public DictComprehension {
    Nodes.required(key, "DictComprehension", "key");
    Nodes.required(value, "DictComprehension", "value");
    generators = Nodes.copy(generators);
    if (generators.isEmpty()) throw new IllegalArgumentException("DictComprehension needs a generator");
  }
}
