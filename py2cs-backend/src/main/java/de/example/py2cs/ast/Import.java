package de.example.py2cs.ast;

import java.util.List;

public record Import(List<Alias> names) implements Stmt {
  public Import {
    names = Nodes.copy(names);
  }
}
