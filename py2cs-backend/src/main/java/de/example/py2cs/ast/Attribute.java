package de.example.py2cs.ast;

public record Attribute(Expr value, String attr) implements Expr {
  public Attribute {
    Nodes.required(value, "Attribute", "value");
    Nodes.required(attr, "Attribute", "attr");
  }
}
