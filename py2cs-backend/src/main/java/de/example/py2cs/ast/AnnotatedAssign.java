package de.example.py2cs.ast;

/** {@code target: annotation [= value]}. */
public record AnnotatedAssign(Expr target, Expr annotation, Expr value) implements Stmt {
  public AnnotatedAssign {
    Nodes.required(target, "AnnotatedAssign", "target");
    Nodes.required(annotation, "AnnotatedAssign", "annotation");
  }
}
