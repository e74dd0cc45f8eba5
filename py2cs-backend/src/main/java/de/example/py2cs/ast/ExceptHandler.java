package de.example.py2cs.ast;

import java.util.List;

/**
 * {@code except type as name: body}.
 *
 * @param type exception kind expression, {@code null} for a bare {@code except:}
 * @param name bound name, {@code null} when not bound
 */
public record ExceptHandler(Expr type, String name, List<Stmt> body) implements Stmt {
  public ExceptHandler {
    body = Nodes.copy(body);
  }
}
