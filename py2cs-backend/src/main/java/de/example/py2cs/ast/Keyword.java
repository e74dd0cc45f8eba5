package de.example.py2cs.ast;

/** Keyword argument {@code arg=value}; {@code arg} is {@code null} for a {@code **kwargs} splat. */
public record Keyword(String arg, Expr value) {
  public Keyword {
    Nodes.required(value, "Keyword", "value");
  }
}
