package de.example.py2cs.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code {k: v, ...}}. A {@code null} key marks a {@code **mapping} splat entry,
 * so the key list is copied null-tolerant.
 */
public record DictLiteral(List<Expr> keys, List<Expr> values) implements Expr {
  public DictLiteral {
    keys = keys == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(keys));
    values = Nodes.copy(values);
    if (keys.size() != values.size()) {
      throw new IllegalArgumentException("DictLiteral needs one value per key");
    }
  }
}
