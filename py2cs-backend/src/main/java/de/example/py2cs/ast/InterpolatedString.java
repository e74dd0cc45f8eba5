package de.example.py2cs.ast;

import java.util.List;

/** An f-string: string {@link Constant} segments and {@link InterpolationSlot}s in source order. */
public record InterpolatedString(List<Expr> values) implements Expr {
  public InterpolatedString {
    values = Nodes.copy(values);
  }
}
