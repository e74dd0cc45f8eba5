package de.example.py2cs.ast;

public record Pass() implements Stmt {}
