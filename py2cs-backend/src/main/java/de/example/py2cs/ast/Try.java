package de.example.py2cs.ast;

import java.util.List;

public record Try(
    List<Stmt> body,
    List<ExceptHandler> handlers,
    List<Stmt> orelse,
    List<Stmt> finalbody
) implements Stmt {

  public Try {
    body = Nodes.copy(body);
    handlers = Nodes.copy(handlers);
    orelse = Nodes.copy(orelse);
    finalbody = Nodes.copy(finalbody);
  }

  public Try(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> finalbody) {
    this(body, handlers, List.of(), finalbody);
  }
}
