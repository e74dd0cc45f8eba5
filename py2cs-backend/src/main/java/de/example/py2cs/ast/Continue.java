package de.example.py2cs.ast;

public record Continue() implements Stmt {}
