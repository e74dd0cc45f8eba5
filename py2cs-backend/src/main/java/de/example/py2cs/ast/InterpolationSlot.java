package de.example.py2cs.ast;

/**
 * {@code {value!conversion:formatSpec}} inside an f-string.
 *
 * @param conversion {@code 's'}, {@code 'r'}, {@code 'a'}, or {@code -1} for none
 * @param formatSpec an {@link InterpolatedString}, or {@code null}
 */
public record InterpolationSlot(Expr value, int conversion, Expr formatSpec) implements Expr {
  public InterpolationSlot {
    Nodes.required(value, "InterpolationSlot", "value");
  }

  public InterpolationSlot(Expr value) {
    this(value, -1, null);
  }
}
