package de.example.py2cs.ast;

public sealed interface Expr extends Node
    permits Constant, NameRef, BinaryOp, UnaryOp, Compare, BoolOp, Call, Attribute, Subscript, Slice,
    ListLiteral, DictLiteral, SetLiteral, TupleLiteral,
    ListComprehension, DictComprehension, SetComprehension,
    InterpolatedString, InterpolationSlot, UnsupportedExpr {}
