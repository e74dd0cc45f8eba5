package de.example.py2cs.ast;

import java.util.List;

public record TupleLiteral(List<Expr> elts) implements Expr {
  public TupleLiteral {
    elts = Nodes.copy(elts);
  }
}
