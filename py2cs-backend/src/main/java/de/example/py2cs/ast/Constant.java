package de.example.py2cs.ast;

/**
 * A literal: {@link String}, {@link Boolean}, a {@link Number}, or {@code null} for {@code None}.
 */
public record Constant(Object value) implements Expr {
  public Constant {
    if (value != null && !(value instanceof String || value instanceof Boolean || value instanceof Number)) {
      throw new IllegalArgumentException("Constant.value has unsupported type " + value.getClass().getName());
    }
  }

  public static Constant none() {
    return new Constant(null);
  }

  public boolean isString() {
    return value instanceof String;
  }
}
