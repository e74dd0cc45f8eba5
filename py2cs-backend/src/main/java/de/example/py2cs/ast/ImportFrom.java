package de.example.py2cs.ast;

import java.util.List;

/**
 * {@code from module import names}.
 *
 * @param module dotted module name, {@code null} for {@code from . import x}
 * @param level number of leading dots of a relative import
 */
public record ImportFrom(String module, List<Alias> names, int level) implements Stmt {
  public ImportFrom {
    names = Nodes.copy(names);
    if (level < 0) throw new IllegalArgumentException("ImportFrom.level must not be negative");
  }

  public ImportFrom(String module, List<Alias> names) {
    this(module, names, 0);
  }
}
