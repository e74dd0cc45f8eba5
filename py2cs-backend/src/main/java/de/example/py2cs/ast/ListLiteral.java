package de.example.py2cs.ast;

import java.util.List;

public record ListLiteral(List<Expr> elts) implements Expr {
  public ListLiteral {
    elts = Nodes.copy(elts);
  }
}
