package de.example.py2cs.ast;

public record Break() implements Stmt {}
