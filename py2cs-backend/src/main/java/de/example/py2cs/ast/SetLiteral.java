package de.example.py2cs.ast;

import java.util.List;

public record SetLiteral(List<Expr> elts) implements Expr {
  public SetLiteral {
    elts = Nodes.copy(elts);
  }
}
