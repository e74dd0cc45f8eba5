package de.example.py2cs.ast;

/** {@code return [value]}; {@code value} is {@code null} for a bare return. */
public record Return(Expr value) implements Stmt {}
