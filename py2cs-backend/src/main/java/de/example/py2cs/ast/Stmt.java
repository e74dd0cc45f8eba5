package de.example.py2cs.ast;

public sealed interface Stmt extends Node
    permits Module, ClassDef, FunctionDef, Return, Assign, AnnotatedAssign, AugmentedAssign,
    If, While, For, Break, Continue, Try, ExceptHandler, Raise, Import, ImportFrom,
    ExpressionStatement, Pass, UnsupportedStmt {}
