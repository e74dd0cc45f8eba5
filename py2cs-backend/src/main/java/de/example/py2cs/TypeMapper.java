package de.example.py2cs;

import de.example.py2cs.ast.*;

import java.util.List;
import java.util.stream.Collectors;

/** Maps Python type annotations to C# type names. */
public final class TypeMapper {
  private final MappingTables tables;

  public TypeMapper(MappingTables tables) {
    this.tables = tables;
  }

  /** Type for a parameter or variable annotation; {@code object} when absent or not understood. */
  public String mapToCSharp(Expr annotation) {
    if (annotation == null) return "object";
    if (isNone(annotation)) return "object";

    if (annotation instanceof NameRef n) return simpleType(n.id());

    // forward reference: def f(x: "Node")
    if (annotation instanceof Constant c && c.isString()) return simpleType((String) c.value());

    if (annotation instanceof Attribute a) return simpleType(a.attr());

    if (annotation instanceof Subscript s) return genericType(s);

    // PEP 604: int | None
    if (annotation instanceof BinaryOp b && b.op() == BinaryOperator.BIT_OR) {
      if (isNone(b.right())) return nullable(mapToCSharp(b.left()));
      if (isNone(b.left())) return nullable(mapToCSharp(b.right()));
    }

    return "object";
  }

  /** Type for a return annotation: {@code void} for {@code None} or when absent. */
  public String mapReturnType(Expr annotation) {
    if (annotation == null || isNone(annotation)) return "void";
    return mapToCSharp(annotation);
  }

  private String simpleType(String name) {
    return switch (name) {
      case "list", "List" -> "List<object>";
      case "dict", "Dict" -> "Dictionary<object, object>";
      case "set", "Set", "frozenset" -> "HashSet<object>";
      case "tuple", "Tuple", "Any", "object" -> "object";
      default -> tables.type(name);
    };
  }

  private String genericType(Subscript s) {
    String base = s.value() instanceof NameRef n ? n.id()
        : s.value() instanceof Attribute a ? a.attr()
        : null;
    if (base == null) return "object";

    List<String> args = typeArguments(s.slice());

    return switch (base) {
      case "list", "List", "Sequence", "Iterable" -> "List<" + arg(args, 0) + ">";
      case "set", "Set", "frozenset" -> "HashSet<" + arg(args, 0) + ">";
      case "dict", "Dict", "Mapping" -> "Dictionary<" + arg(args, 0) + ", " + arg(args, 1) + ">";
      case "tuple", "Tuple" -> args.size() >= 2 ? "(" + String.join(", ", args) + ")" : "object";
      case "Optional" -> nullable(arg(args, 0));
      default -> tables.type(base) + "<" + String.join(", ", args) + ">";
    };
  }

  private List<String> typeArguments(Expr slice) {
    if (slice instanceof TupleLiteral t) {
      return t.elts().stream().map(this::mapToCSharp).collect(Collectors.toList());
    }
    return List.of(mapToCSharp(slice));
  }

  private static String arg(List<String> args, int i) {
    return i < args.size() ? args.get(i) : "object";
  }

  private static String nullable(String t) {
    return t.endsWith("?") ? t : t + "?";
  }

  private static boolean isNone(Expr e) {
    return (e instanceof Constant c && c.value() == null)
        || (e instanceof NameRef n && n.id().equals("None"));
  }
}
