package de.example.py2cs.ast;

import java.util.List;

public record ClassDef(String name, List<Expr> bases, List<Stmt> body) implements Stmt {
  public ClassDef {
    Nodes.required(name, "ClassDef", "name");
    bases = Nodes.copy(bases);
    body = Nodes.copy(body);
  }
}
