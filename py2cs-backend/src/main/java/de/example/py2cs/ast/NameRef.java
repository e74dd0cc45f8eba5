package de.example.py2cs.ast;

public record NameRef(String id) implements Expr {
  public NameRef {
    Nodes.required(id, "NameRef", "id");
  }
}
