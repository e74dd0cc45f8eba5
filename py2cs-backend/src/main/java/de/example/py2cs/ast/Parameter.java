package de.example.py2cs.ast;

/**
 * A positional parameter of a {@link FunctionDef}.
 *
 * @param annotation type annotation, may be {@code null}
 * @param defaultValue default value, may be {@code null}
 */
public record Parameter(String name, Expr annotation, Expr defaultValue) {
  public Parameter {
    Nodes.required(name, "Parameter", "name");
  }

  public Parameter(String name, Expr annotation) {
    this(name, annotation, null);
  }

  public static Parameter of(String name) {
    return new Parameter(name, null, null);
  }
}
