package de.example.py2cs.ast;

import java.util.List;

/** Tree root. */
public record Module(List<Stmt> body) implements Stmt {
  public Module {
    body = Nodes.copy(body);
  }
}
