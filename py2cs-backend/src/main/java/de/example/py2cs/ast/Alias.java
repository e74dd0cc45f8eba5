package de.example.py2cs.ast;

/** An imported name, {@code name [as asName]}. */
public record Alias(String name, String asName) {
  public Alias {
    Nodes.required(name, "Alias", "name");
  }

  public static Alias of(String name) {
    return new Alias(name, null);
  }
}
